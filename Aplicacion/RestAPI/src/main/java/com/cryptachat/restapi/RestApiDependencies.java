package com.cryptachat.restapi;

import java.util.Objects;

import com.cryptachat.controladores.conexion.ConnectionHub;
import com.cryptachat.controladores.conexion.HubSettings;
import com.cryptachat.servicios.ClaveService;
import com.cryptachat.servicios.ContactoService;
import com.cryptachat.servicios.MensajeriaService;
import com.cryptachat.servicios.RegistroService;
import com.cryptachat.servicios.security.TokenService;

/**
 * Servicios construidos por el arranque que la API necesita como beans.
 */
public record RestApiDependencies(RegistroService registroService,
                                  ClaveService claveService,
                                  ContactoService contactoService,
                                  MensajeriaService mensajeriaService,
                                  TokenService tokenService,
                                  ConnectionHub connectionHub,
                                  HubSettings hubSettings) {

    public RestApiDependencies {
        Objects.requireNonNull(registroService, "registroService");
        Objects.requireNonNull(claveService, "claveService");
        Objects.requireNonNull(contactoService, "contactoService");
        Objects.requireNonNull(mensajeriaService, "mensajeriaService");
        Objects.requireNonNull(tokenService, "tokenService");
        Objects.requireNonNull(connectionHub, "connectionHub");
        Objects.requireNonNull(hubSettings, "hubSettings");
    }
}
