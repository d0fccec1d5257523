package io.routeweave.core.rule;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("IdNormalizer")
class IdNormalizerTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
        "my-router, my-router",
        "my-router@file, my-router",
        "my-router@docker, my-router",
        "svc-auth, svc-auth",
        "svc-auth-auth, svc-auth",
        "svc-auth-auth-auth@http, svc-auth",
        "app-redirect-auth, app-redirect",
        "app-redirect-auth@file, app-redirect",
        "a@b@c, a"
    })
    void normalizes(String input, String expected) {
        assertThat(IdNormalizer.normalize(input)).isEqualTo(expected);
    }

    @Test
    void nullNormalizesToEmpty() {
        assertThat(IdNormalizer.normalize(null)).isEmpty();
        assertThat(IdNormalizer.stripProvider(null)).isEmpty();
        assertThat(IdNormalizer.providerSuffix(null)).isEmpty();
    }

    @Test
    @DisplayName("providerSuffix keeps the @ sign")
    void providerSuffix() {
        assertThat(IdNormalizer.providerSuffix("web@docker")).isEqualTo("@docker");
        assertThat(IdNormalizer.providerSuffix("web")).isEmpty();
    }
}
