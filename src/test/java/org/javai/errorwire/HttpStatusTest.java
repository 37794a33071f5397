package org.javai.errorwire;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HttpStatusTest {

    @Test
    void reasonPhrase_knownStatus() {
        assertThat(HttpStatus.reasonPhrase(404)).contains("Not Found");
        assertThat(HttpStatus.reasonPhrase(500)).contains("Internal Server Error");
    }

    @Test
    void reasonPhrase_unknownStatus_isEmpty() {
        assertThat(HttpStatus.reasonPhrase(299)).isEmpty();
    }

    @Test
    void snakeCaseName_lowercasesAndJoinsWithUnderscores() {
        assertThat(HttpStatus.snakeCaseName(404)).contains("not_found");
        assertThat(HttpStatus.snakeCaseName(405)).contains("method_not_allowed");
        assertThat(HttpStatus.snakeCaseName(503)).contains("service_unavailable");
    }

    @Test
    void isValid_coversStatusLineRange() {
        assertThat(HttpStatus.isValid(100)).isTrue();
        assertThat(HttpStatus.isValid(599)).isTrue();
        assertThat(HttpStatus.isValid(0)).isFalse();
        assertThat(HttpStatus.isValid(99)).isFalse();
        assertThat(HttpStatus.isValid(600)).isFalse();
    }
}
