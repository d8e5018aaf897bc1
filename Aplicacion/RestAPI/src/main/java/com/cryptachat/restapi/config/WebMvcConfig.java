package com.cryptachat.restapi.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.cryptachat.restapi.security.AuthInterceptor;
import com.cryptachat.servicios.security.TokenService;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    public static final String[] RUTAS_PROTEGIDAS = {
        "/upload_key", "/get_key",
        "/request_chat", "/get_chat_requests", "/accept_chat", "/get_contacts",
        "/send_message", "/get_messages"
    };

    private final TokenService tokenService;

    public WebMvcConfig(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AuthInterceptor(tokenService))
                .addPathPatterns(RUTAS_PROTEGIDAS);
    }
}
