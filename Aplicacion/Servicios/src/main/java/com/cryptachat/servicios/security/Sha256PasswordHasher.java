package com.cryptachat.servicios.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * SHA-256 con sal aleatoria por usuario y una pimienta común configurada.
 * El valor almacenado tiene la forma {@code salHex$hashHex}.
 */
public class Sha256PasswordHasher implements PasswordHasher {

    private static final String DEFAULT_PEPPER = "cryptachat";
    private static final int SALT_BYTES = 16;
    private static final char SEPARATOR = '$';

    private final String pepper;
    private final SecureRandom random = new SecureRandom();

    public Sha256PasswordHasher(String pepper) {
        this.pepper = pepper != null && !pepper.isBlank() ? pepper : DEFAULT_PEPPER;
    }

    @Override
    public String hash(String rawPassword) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        String saltHex = HexFormat.of().formatHex(salt);
        return saltHex + SEPARATOR + HexFormat.of().formatHex(digest(saltHex, rawPassword));
    }

    @Override
    public boolean matches(String rawPassword, String hashedPassword) {
        if (rawPassword == null || hashedPassword == null) {
            return false;
        }
        int idx = hashedPassword.indexOf(SEPARATOR);
        if (idx <= 0) {
            return false;
        }
        String saltHex = hashedPassword.substring(0, idx);
        byte[] expected;
        try {
            expected = HexFormat.of().parseHex(hashedPassword.substring(idx + 1));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(expected, digest(saltHex, rawPassword));
    }

    private byte[] digest(String saltHex, String rawPassword) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest((saltHex + rawPassword + pepper).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
