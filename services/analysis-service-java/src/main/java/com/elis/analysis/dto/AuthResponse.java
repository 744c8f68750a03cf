package com.elis.analysis.dto;

public record AuthResponse(
        String accessToken,
        long expiresIn,
        String tokenType,
        String username
) {
    public static AuthResponse of(String accessToken, long expiresInMs, String username) {
        return new AuthResponse(accessToken, expiresInMs / 1000, "Bearer", username);
    }
}
