package com.cryptachat.servicios.security;

/**
 * Identidad verificada extraída de un token.
 */
public record UsuarioAutenticado(Long id, String nombreDeUsuario) {
}
