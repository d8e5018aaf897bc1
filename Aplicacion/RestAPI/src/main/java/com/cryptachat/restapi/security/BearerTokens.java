package com.cryptachat.restapi.security;

import com.cryptachat.servicios.security.TokenInvalidoException;

/**
 * Extrae el token de una cabecera {@code Authorization: Bearer <token>}.
 */
public final class BearerTokens {

    private static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    public static String extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new TokenInvalidoException("Token is missing!");
        }
        if (!authorizationHeader.startsWith(PREFIX)) {
            throw new TokenInvalidoException("Invalid token format");
        }
        String token = authorizationHeader.substring(PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new TokenInvalidoException("Invalid token format");
        }
        return token;
    }
}
