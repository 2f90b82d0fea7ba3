package org.rtbsa.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.rtbsa.core.error.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BeamlineTest {

    @Test
    void parsesKnownNamesIgnoringCase() {
        assertThat(Beamline.parse("nc_hxr")).isEqualTo(Beamline.NC_HXR);
        assertThat(Beamline.parse(" SC_SXR ")).isEqualTo(Beamline.SC_SXR);
    }

    @Test
    void rejectsUnknownBeamline() {
        assertThatThrownBy(() -> Beamline.parse("LCLS_III"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("LCLS_III");
        assertThatThrownBy(() -> Beamline.parse(" ")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void mapsToFacilityRateSourceAndEdef() {
        assertThat(Beamline.NC_SXR.rateSourceAddress()).isEqualTo("EVNT:SYS0:1:NC_SOFTRATE");
        assertThat(Beamline.SC_HXR.historyEdef()).isEqualTo("HSTSCH");
        assertThat(Beamline.F2.maxRateHz()).isEqualTo(30.0);
        assertThat(Beamline.SC_BSYD.facility()).isEqualTo(Facility.SC);
    }

    @ParameterizedTest
    @CsvSource({
            "NC_HXR, 1.0,   1H",
            "NC_HXR, 9.99,  1H",
            "NC_HXR, 10.0,  TH",
            "NC_HXR, 60.0,  TH",
            "NC_HXR, 120.0, BR",
            "SC_SXR, 101.0, TH",
            "SC_SXR, 102.0, HH",
            "F2,     30.0,  BR",
            "F2,     NaN,   1H"
    })
    void picksHistorySuffixByRate(String beamline, double rate, String suffix) {
        assertThat(Beamline.valueOf(beamline).historySuffix(rate)).isEqualTo(suffix);
    }

    @Test
    void historyAddressAppendsEdefAndSuffix() {
        assertThat(Beamline.NC_HXR.historyAddress("BLEN:LI21:265:AIMAX", 60.0))
                .isEqualTo("BLEN:LI21:265:AIMAXHSTCUHTH");
    }
}
