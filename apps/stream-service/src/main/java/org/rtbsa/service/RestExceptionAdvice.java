package org.rtbsa.service;

import org.rtbsa.core.error.ConfigurationException;
import org.rtbsa.core.error.StreamInitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.NoSuchElementException;

@ControllerAdvice
public class RestExceptionAdvice {
    private static final Logger log = LoggerFactory.getLogger(RestExceptionAdvice.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<String> badConfig(ConfigurationException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<String> notFound(NoSuchElementException ex) {
        return ResponseEntity.status(404).body(ex.getMessage());
    }

    @ExceptionHandler(StreamInitException.class)
    public ResponseEntity<String> initFailed(StreamInitException ex) {
        log.warn("{}", ex.getMessage(), ex.getCause());
        String cause = ex.getCause() != null ? ": " + ex.getCause().getMessage() : "";
        return ResponseEntity.status(503).body(ex.getMessage() + cause);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<String> unsupported(UnsupportedOperationException ex) {
        String msg = ex.getMessage() != null ? ex.getMessage() : "Operation not implemented";
        return ResponseEntity.status(501).body(msg);
    }
}
