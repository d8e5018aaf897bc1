package com.cryptachat.restapi.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.cryptachat.dto.ApiMessage;
import com.cryptachat.dto.KeyUploadRequest;
import com.cryptachat.dto.PublicKeyResponse;
import com.cryptachat.restapi.config.SwaggerConfig;
import com.cryptachat.restapi.security.AuthInterceptor;
import com.cryptachat.servicios.ClaveService;
import com.cryptachat.servicios.security.UsuarioAutenticado;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@Tag(name = "Claves", description = "Publicación y consulta de claves públicas")
@SecurityRequirement(name = SwaggerConfig.BEARER_SCHEME)
public class KeyController {

    private final ClaveService claveService;

    public KeyController(ClaveService claveService) {
        this.claveService = claveService;
    }

    @Operation(summary = "Publicar o reemplazar la clave pública propia")
    @PostMapping("/upload_key")
    public ApiMessage uploadKey(@RequestAttribute(AuthInterceptor.USUARIO_ATTR) UsuarioAutenticado usuario,
                                @RequestBody KeyUploadRequest request) {
        claveService.subirClave(usuario.id(), request.getPublicKey());
        return new ApiMessage("Public key uploaded successfully.");
    }

    @Operation(summary = "Consultar la clave pública de un usuario")
    @GetMapping("/get_key")
    public PublicKeyResponse getKey(@RequestParam(name = "username", required = false) String username) {
        return new PublicKeyResponse(username, claveService.obtenerClave(username));
    }
}
