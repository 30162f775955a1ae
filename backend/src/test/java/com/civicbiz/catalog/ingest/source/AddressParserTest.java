package com.civicbiz.catalog.ingest.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressParserTest {

    @Test
    void splitsStreetCityStateAndZip() {
        AddressParser.ParsedAddress parsed = AddressParser.parse("1 Main St, Des Moines, ia 50309-1234, USA");

        assertThat(parsed.street()).isEqualTo("1 Main St");
        assertThat(parsed.city()).isEqualTo("Des Moines");
        assertThat(parsed.state()).isEqualTo("IA");
        assertThat(parsed.zipCode()).isEqualTo("50309-1234");
    }

    @Test
    void unitLinesStayWithTheStreet() {
        AddressParser.ParsedAddress parsed = AddressParser.parse("123 Main St, Suite 5, Des Moines, IA 50309, USA");

        assertThat(parsed.street()).isEqualTo("123 Main St, Suite 5");
        assertThat(parsed.city()).isEqualTo("Des Moines");
        assertThat(parsed.state()).isEqualTo("IA");
        assertThat(parsed.zipCode()).isEqualTo("50309");
    }

    @Test
    void cityAndStateWithoutStreet() {
        AddressParser.ParsedAddress zipped = AddressParser.parse("Des Moines, IA 50309");
        assertThat(zipped.street()).isNull();
        assertThat(zipped.city()).isEqualTo("Des Moines");
        assertThat(zipped.state()).isEqualTo("IA");

        AddressParser.ParsedAddress bare = AddressParser.parse("9 Elm St, Ames, ia");
        assertThat(bare.street()).isEqualTo("9 Elm St");
        assertThat(bare.city()).isEqualTo("Ames");
        assertThat(bare.state()).isEqualTo("IA");
        assertThat(bare.zipCode()).isNull();
    }

    @Test
    void toleratesShortAddresses() {
        AddressParser.ParsedAddress parsed = AddressParser.parse("1 Main St");

        assertThat(parsed.street()).isEqualTo("1 Main St");
        assertThat(parsed.city()).isNull();
        assertThat(parsed.state()).isNull();
        assertThat(AddressParser.parse("  ").street()).isNull();
    }

    @Test
    void cityMatchIsCaseInsensitive() {
        assertThat(AddressParser.mentionsCity("1 Main St, DES MOINES, IA", " des moines ")).isTrue();
        assertThat(AddressParser.mentionsCity("200 Lincoln Way, Ames, IA", "Des Moines")).isFalse();
        assertThat(AddressParser.mentionsCity(null, "Des Moines")).isFalse();
    }
}
