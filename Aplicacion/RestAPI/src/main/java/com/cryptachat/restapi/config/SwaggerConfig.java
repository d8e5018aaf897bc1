package com.cryptachat.restapi.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuración de Swagger/OpenAPI para la documentación de la REST API.
 */
@Configuration
public class SwaggerConfig {

    public static final String BEARER_SCHEME = "bearerAuth";

    @Value("${server.port:5000}")
    private int serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CryptaChat - REST API")
                        .version("1.0.0")
                        .description("Registro, intercambio de claves públicas, solicitudes de chat y " +
                                   "mensajería cifrada extremo a extremo. Los mensajes nuevos se notifican " +
                                   "por el canal push en /ws."))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Servidor de desarrollo local")
                ));
    }
}
