package com.civicbiz.catalog.ingest.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StateCodesTest {

    @Test
    void resolvesNamesAndCodesCaseInsensitively() {
        assertThat(StateCodes.normalize("iowa")).isEqualTo("IA");
        assertThat(StateCodes.normalize(" New   York ")).isEqualTo("NY");
        assertThat(StateCodes.normalize("tx")).isEqualTo("TX");
        assertThat(StateCodes.lookup("district of columbia")).contains("DC");
        assertThat(StateCodes.lookup("Atlantis")).isEmpty();
        assertThat(StateCodes.nameFor("ca")).contains("California");
    }

    @Test
    void unknownValuesFallBackToFirstTwoLetters() {
        assertThat(StateCodes.normalize("Ontario")).isEqualTo("ON");
        assertThat(StateCodes.normalize("q")).isEqualTo("Q");
        assertThat(StateCodes.normalize("123")).isNull();
        assertThat(StateCodes.normalize("  ")).isNull();
        assertThat(StateCodes.normalize(null)).isNull();
    }
}
