package com.example.bugstream.stream.security;

import com.example.bugstream.shared.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesApiKeyValidatorTest {

    private PropertiesApiKeyValidator validator;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getSecurity().getApiKeys().put("key-12345", "carol");
        validator = new PropertiesApiKeyValidator(properties);
    }

    @Test
    void knownKeyResolvesUser() {
        StepVerifier.create(validator.validate("key-12345"))
                .assertNext(result -> {
                    assertThat(result.valid()).isTrue();
                    assertThat(result.userId()).isEqualTo("carol");
                    assertThat(result.apiKey()).isEqualTo("key-12345");
                })
                .verifyComplete();
    }

    @Test
    void unknownOrBlankKeyIsInvalid() {
        StepVerifier.create(validator.validate("nope"))
                .assertNext(result -> assertThat(result.valid()).isFalse())
                .verifyComplete();
        StepVerifier.create(validator.validate(" "))
                .assertNext(result -> assertThat(result.valid()).isFalse())
                .verifyComplete();
    }

    @Test
    void maskHidesAllButPrefix() {
        assertThat(PropertiesApiKeyValidator.mask("key-12345")).isEqualTo("key-****");
        assertThat(PropertiesApiKeyValidator.mask("abc")).isEqualTo("****");
    }
}
