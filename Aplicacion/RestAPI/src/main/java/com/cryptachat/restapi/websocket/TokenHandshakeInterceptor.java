package com.cryptachat.restapi.websocket;

import java.util.Map;
import java.util.logging.Logger;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import com.cryptachat.restapi.security.BearerTokens;
import com.cryptachat.servicios.security.TokenInvalidoException;
import com.cryptachat.servicios.security.TokenService;
import com.cryptachat.servicios.security.UsuarioAutenticado;

/**
 * Autentica el handshake con el mismo token Bearer de la API REST. Los
 * navegadores no pueden fijar cabeceras en un WebSocket, así que también se
 * acepta el parámetro {@code token}.
 */
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USUARIO_ATTR = "usuarioAutenticado";

    private static final Logger LOGGER = Logger.getLogger(TokenHandshakeInterceptor.class.getName());

    private final TokenService tokenService;

    public TokenHandshakeInterceptor(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        try {
            UsuarioAutenticado usuario = tokenService.verify(extraerToken(request));
            attributes.put(USUARIO_ATTR, usuario);
            return true;
        } catch (TokenInvalidoException e) {
            LOGGER.fine(() -> "Handshake WebSocket rechazado: " + e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nada
    }

    private static String extraerToken(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null) {
            return BearerTokens.extract(header);
        }
        String token = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
        if (token == null || token.isBlank()) {
            throw new TokenInvalidoException("Token is missing!");
        }
        return token;
    }
}
