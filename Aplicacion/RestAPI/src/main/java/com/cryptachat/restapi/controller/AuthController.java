package com.cryptachat.restapi.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.cryptachat.dto.ApiMessage;
import com.cryptachat.dto.AuthRequest;
import com.cryptachat.dto.TokenResponse;
import com.cryptachat.servicios.RegistroService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Registro de usuarios e inicio de sesión.
 */
@RestController
@Tag(name = "Autenticación", description = "Registro e inicio de sesión")
public class AuthController {

    private final RegistroService registroService;

    public AuthController(RegistroService registroService) {
        this.registroService = registroService;
    }

    @Operation(summary = "Registrar un usuario nuevo")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Usuario registrado"),
            @ApiResponse(responseCode = "400", description = "Faltan usuario o contraseña"),
            @ApiResponse(responseCode = "409", description = "El nombre de usuario ya existe")
    })
    @PostMapping("/register")
    public ResponseEntity<ApiMessage> register(@RequestBody AuthRequest request) {
        registroService.registrar(request.getUsername(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiMessage("New user registered successfully!"));
    }

    @Operation(summary = "Iniciar sesión", description = "Devuelve un token Bearer válido durante el tiempo configurado.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token emitido"),
            @ApiResponse(responseCode = "401", description = "Credenciales inválidas")
    })
    @PostMapping("/login")
    public TokenResponse login(@RequestBody AuthRequest request) {
        return new TokenResponse(registroService.iniciarSesion(request.getUsername(), request.getPassword()));
    }
}
