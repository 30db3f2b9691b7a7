package com.example.bugstream.stream.security;

import com.example.bugstream.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Validates keys against {@code bugstream.security.api-keys}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesApiKeyValidator implements ApiKeyValidator {

    private final AppProperties appProperties;

    @Override
    public Mono<ApiKeyValidation> validate(String token) {
        return Mono.fromSupplier(() -> {
            if (token == null || token.isBlank()) {
                return ApiKeyValidation.invalid();
            }
            String userId = appProperties.getSecurity().getApiKeys().get(token);
            if (userId == null) {
                log.debug("Unknown API key {}", mask(token));
                return ApiKeyValidation.invalid();
            }
            return ApiKeyValidation.valid(userId, token);
        });
    }

    static String mask(String token) {
        if (token.length() <= 4) {
            return "****";
        }
        return token.substring(0, 4) + "****";
    }
}
