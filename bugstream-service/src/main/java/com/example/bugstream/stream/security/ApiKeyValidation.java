package com.example.bugstream.stream.security;

public record ApiKeyValidation(boolean valid, String userId, String apiKey) {

    public static ApiKeyValidation invalid() {
        return new ApiKeyValidation(false, null, null);
    }

    public static ApiKeyValidation valid(String userId, String apiKey) {
        return new ApiKeyValidation(true, userId, apiKey);
    }
}
