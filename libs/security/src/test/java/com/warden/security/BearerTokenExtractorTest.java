package com.warden.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("valid values")
    class ValidValues {

        @Test
        @DisplayName("extracts token from 'Bearer xxx'")
        void extractsToken() {
            assertThat(BearerTokenExtractor.extract("Bearer eyJhbGciOiJIUzI1NiJ9.payload.sig"))
                    .contains("eyJhbGciOiJIUzI1NiJ9.payload.sig");
        }

        @Test
        @DisplayName("is case-insensitive for the scheme")
        void caseInsensitive() {
            assertThat(BearerTokenExtractor.extract("bearer my-token")).contains("my-token");
            assertThat(BearerTokenExtractor.extract("BEARER my-token")).contains("my-token");
        }

        @Test
        @DisplayName("tolerates extra whitespace")
        void extraWhitespace() {
            assertThat(BearerTokenExtractor.extract("  Bearer    my-token  ")).contains("my-token");
        }
    }

    @Nested
    @DisplayName("invalid values")
    class InvalidValues {

        @Test
        @DisplayName("returns empty for null or blank")
        void nullOrBlank() {
            assertThat(BearerTokenExtractor.extract(null)).isEmpty();
            assertThat(BearerTokenExtractor.extract("   ")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for another scheme")
        void otherScheme() {
            assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
        }

        @Test
        @DisplayName("returns empty when the scheme has no token")
        void schemeOnly() {
            assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearer   ")).isEmpty();
        }

        @Test
        @DisplayName("rejects a scheme glued to the token")
        void gluedScheme() {
            assertThat(BearerTokenExtractor.extract("Bearermy-token")).isEmpty();
        }
    }
}
