package com.cryptachat.restapi.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.cryptachat.dto.ApiMessage;
import com.cryptachat.dto.ChatRequestPayload;
import com.cryptachat.dto.ContactsResponse;
import com.cryptachat.dto.PendingRequestsResponse;
import com.cryptachat.restapi.config.SwaggerConfig;
import com.cryptachat.restapi.security.AuthInterceptor;
import com.cryptachat.servicios.ContactoService;
import com.cryptachat.servicios.security.UsuarioAutenticado;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Solicitudes de chat entre dos usuarios y lista de contactos resultante.
 */
@RestController
@Tag(name = "Contactos", description = "Solicitudes de chat y contactos")
@SecurityRequirement(name = SwaggerConfig.BEARER_SCHEME)
public class ChatRequestController {

    private final ContactoService contactoService;

    public ChatRequestController(ContactoService contactoService) {
        this.contactoService = contactoService;
    }

    @Operation(summary = "Enviar una solicitud de chat")
    @PostMapping("/request_chat")
    public ResponseEntity<ApiMessage> requestChat(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario,
                                                  @RequestBody ChatRequestPayload payload) {
        contactoService.solicitarChat(usuario.id(), payload.getRecipientUsername());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiMessage("Chat request sent to " + payload.getRecipientUsername() + "."));
    }

    @Operation(summary = "Listar solicitudes pendientes recibidas")
    @GetMapping("/get_chat_requests")
    public PendingRequestsResponse getChatRequests(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario) {
        return new PendingRequestsResponse(contactoService.solicitudesPendientes(usuario.id()));
    }

    @Operation(summary = "Aceptar una solicitud pendiente")
    @PostMapping("/accept_chat")
    public ApiMessage acceptChat(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario,
                                 @RequestBody ChatRequestPayload payload) {
        contactoService.aceptarSolicitud(usuario.id(), payload.getRequesterUsername());
        return new ApiMessage("Chat request from " + payload.getRequesterUsername() + " accepted!");
    }

    @Operation(summary = "Listar contactos con solicitud aceptada")
    @GetMapping("/get_contacts")
    public ContactsResponse getContacts(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario) {
        return new ContactsResponse(contactoService.contactos(usuario.id()));
    }
}
