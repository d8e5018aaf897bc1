package com.cryptachat.restapi.security;

import java.util.Objects;

import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

import com.cryptachat.servicios.security.TokenService;
import com.cryptachat.servicios.security.UsuarioAutenticado;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Exige un token válido en las rutas protegidas y deja la identidad verificada
 * como atributo de la petición. Los fallos llegan al
 * {@code ApiExceptionHandler} como {@code TokenInvalidoException}.
 */
public class AuthInterceptor implements HandlerInterceptor {

    public static final String USUARIO_ATTR = "usuarioAutenticado";

    private final TokenService tokenService;

    public AuthInterceptor(TokenService tokenService) {
        this.tokenService = Objects.requireNonNull(tokenService, "tokenService");
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = BearerTokens.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        UsuarioAutenticado usuario = tokenService.verify(token);
        request.setAttribute(USUARIO_ATTR, usuario);
        return true;
    }
}
