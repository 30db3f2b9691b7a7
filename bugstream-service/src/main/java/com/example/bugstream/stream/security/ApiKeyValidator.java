package com.example.bugstream.stream.security;

import reactor.core.publisher.Mono;

/**
 * Resolves a client-supplied credential to a user. May complete with an error when the
 * backing store is unreachable; callers treat that the same as an invalid key.
 */
public interface ApiKeyValidator {

    Mono<ApiKeyValidation> validate(String token);
}
