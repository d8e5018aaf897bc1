package com.cryptachat.servicios.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;

/**
 * Tokens compactos {@code header.claims.firma} compatibles con JWT HS256.
 */
public class HmacTokenService implements TokenService {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String HEADER = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public HmacTokenService(String secret, Duration ttl) {
        this(secret, ttl, Clock.systemUTC());
    }

    public HmacTokenService(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("El secreto de tokens es obligatorio");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String issue(Long usuarioId, String nombreDeUsuario) {
        long now = clock.instant().getEpochSecond();
        ObjectNode claims = mapper.createObjectNode();
        claims.put("user_id", usuarioId);
        claims.put("username", nombreDeUsuario);
        claims.put("iat", now);
        claims.put("exp", now + ttl.getSeconds());
        String payload;
        try {
            payload = mapper.writeValueAsString(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudieron serializar los claims", e);
        }
        String signingInput = encode(HEADER) + "." + encode(payload);
        return signingInput + "." + ENCODER.encodeToString(sign(signingInput));
    }

    @Override
    public UsuarioAutenticado verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidoException("Token is missing!");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenInvalidoException("Token is invalid!");
        }
        byte[] firma;
        JsonNode header;
        JsonNode claims;
        try {
            firma = DECODER.decode(parts[2]);
            header = mapper.readTree(DECODER.decode(parts[0]));
            claims = mapper.readTree(DECODER.decode(parts[1]));
        } catch (IllegalArgumentException | IOException e) {
            throw new TokenInvalidoException("Token is invalid!", e);
        }
        if (header == null || !"HS256".equals(header.path("alg").asText())) {
            throw new TokenInvalidoException("Token is invalid!");
        }
        if (!MessageDigest.isEqual(firma, sign(parts[0] + "." + parts[1]))) {
            throw new TokenInvalidoException("Token is invalid!");
        }
        if (claims == null || !claims.hasNonNull("user_id") || !claims.hasNonNull("exp")) {
            throw new TokenInvalidoException("Token is invalid!");
        }
        if (claims.get("exp").asLong() <= clock.instant().getEpochSecond()) {
            throw new TokenInvalidoException("Token has expired!");
        }
        return new UsuarioAutenticado(claims.get("user_id").asLong(), claims.path("username").asText(null));
    }

    private String encode(String json) {
        return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
