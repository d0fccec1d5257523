package io.routeweave.core.rule;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RuleParser")
class RuleParserTest {

    @Nested
    @DisplayName("extractHost")
    class ExtractHost {

        @ParameterizedTest(name = "{0} → {1}")
        @CsvSource(
                delimiter = ';',
                value = {
                    "Host(`app.example.com`);app.example.com",
                    "Host(`a.example.com`) || Host(`b.example.com`);a.example.com",
                    "Host(`api.example.com`) && PathPrefix(`/v1`);api.example.com",
                    "PathPrefix(`/v1`) && Host(`api.example.com`);api.example.com",
                    "Host:legacy.example.com;legacy.example.com",
                    "Host:legacy.example.com,other;legacy.example.com",
                    "Host:legacy.example.com) && Path(`/`);legacy.example.com",
                    "HostRegexp(`.+`);any-host"
                })
        void extractsLiteralHost(String rule, String expected) {
            assertThat(RuleParser.extractHost(rule)).isEqualTo(expected);
        }

        @Test
        @DisplayName("quoted Host wins over a HostRegexp in the same rule")
        void quotedHostTakesPrecedence() {
            assertThat(RuleParser.extractHost("HostRegexp(`.+`) || Host(`exact.example.com`)"))
                    .isEqualTo("exact.example.com");
        }

        @Test
        @DisplayName("HostRegexp patterns are simplified into a readable host")
        void simplifiesRegexp() {
            String host = RuleParser.extractHost("HostRegexp(`^[a-z]+\\.example\\.com$`)");

            assertThat(host).isEqualTo("x.example.com");
            assertThat(RuleParser.extractHost("HostRegexp(`^[a-z]+\\.example\\.com$`)"))
                    .isEqualTo(host);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "PathPrefix(`/api`)", "Host(`unterminated", "garbage && more garbage", "&&"})
        @DisplayName("unsupported or empty rules yield the empty string")
        void unsupportedRulesYieldEmpty(String rule) {
            assertThat(RuleParser.extractHost(rule)).isEmpty();
        }
    }

    @Nested
    @DisplayName("SNI rules")
    class Sni {

        @Test
        void extractsHostSni() {
            assertThat(RuleParser.extractHostSni("HostSNI(`db.example.com`)")).isEqualTo("db.example.com");
            assertThat(RuleParser.extractSniHost("HostSNI(`db.example.com`)")).isEqualTo("db.example.com");
        }

        @Test
        void fallsBackToSniRegexp() {
            assertThat(RuleParser.extractSniHost("HostSNIRegexp(`^db-(a|b)\\.example\\.com$`)"))
                    .isEqualTo("db-a-b.example.com");
        }

        @Test
        void catchAllSniIsReturnedVerbatim() {
            assertThat(RuleParser.extractHostSni("HostSNI(`*`)")).isEqualTo("*");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"Host(`web.example.com`)", "ClientIP(`10.0.0.1`)"})
        void nonSniRulesYieldEmpty(String rule) {
            assertThat(RuleParser.extractSniHost(rule)).isEmpty();
        }
    }
}
