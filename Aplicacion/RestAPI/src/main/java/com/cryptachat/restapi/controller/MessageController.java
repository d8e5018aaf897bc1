package com.cryptachat.restapi.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.cryptachat.dto.ApiMessage;
import com.cryptachat.dto.MessagesResponse;
import com.cryptachat.dto.SendMessageRequest;
import com.cryptachat.restapi.config.SwaggerConfig;
import com.cryptachat.restapi.security.AuthInterceptor;
import com.cryptachat.servicios.MensajeriaService;
import com.cryptachat.servicios.security.UsuarioAutenticado;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Envío y sondeo de mensajes cifrados. El servidor solo almacena los blobs.
 */
@RestController
@Tag(name = "Mensajes", description = "Envío y consulta de mensajes cifrados")
@SecurityRequirement(name = SwaggerConfig.BEARER_SCHEME)
public class MessageController {

    private final MensajeriaService mensajeriaService;

    public MessageController(MensajeriaService mensajeriaService) {
        this.mensajeriaService = mensajeriaService;
    }

    @Operation(
            summary = "Enviar un mensaje",
            description = "Guarda el blob del emisor y el del receptor; si el receptor está conectado " +
                         "se le notifica por el canal push."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Mensaje almacenado"),
            @ApiResponse(responseCode = "400", description = "Faltan campos"),
            @ApiResponse(responseCode = "404", description = "Receptor desconocido")
    })
    @PostMapping("/send_message")
    public ResponseEntity<ApiMessage> sendMessage(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario,
                                                  @RequestBody SendMessageRequest request) {
        mensajeriaService.enviarMensaje(usuario.id(), request.getRecipientUsername(),
                request.getSenderBlob(), request.getRecipientBlob());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiMessage("Message sent successfully."));
    }

    @Operation(summary = "Sondear la conversación con otro usuario")
    @GetMapping("/get_messages")
    public MessagesResponse getMessages(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario,
                                        @RequestParam(name = "username", required = false) String username,
                                        @Parameter(description = "Solo mensajes con id mayor que este valor")
                                        @RequestParam(name = "since_id", required = false) String sinceId) {
        return new MessagesResponse(mensajeriaService.obtenerMensajes(usuario.id(), username, parseSinceId(sinceId)));
    }

    private static long parseSinceId(String raw) {
        if (raw == null || raw.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid since_id parameter, must be an integer.");
        }
    }
}
