package com.cryptachat.restapi.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.cryptachat.controladores.conexion.ConnectionHub;
import com.cryptachat.controladores.conexion.HubSettings;
import com.cryptachat.restapi.websocket.PushWebSocketHandler;
import com.cryptachat.restapi.websocket.TokenHandshakeInterceptor;
import com.cryptachat.servicios.security.TokenService;

/**
 * Canal push en tiempo real: WebSocket nativo en /ws, autenticado durante el
 * handshake.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConnectionHub connectionHub;
    private final HubSettings hubSettings;
    private final TokenService tokenService;

    public WebSocketConfig(ConnectionHub connectionHub, HubSettings hubSettings, TokenService tokenService) {
        this.connectionHub = connectionHub;
        this.hubSettings = hubSettings;
        this.tokenService = tokenService;
    }

    @Bean
    public PushWebSocketHandler pushWebSocketHandler() {
        return new PushWebSocketHandler(connectionHub, hubSettings);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(pushWebSocketHandler(), "/ws")
                .addInterceptors(new TokenHandshakeInterceptor(tokenService))
                .setAllowedOriginPatterns("*");
    }
}
