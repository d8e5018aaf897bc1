package com.cryptachat.servicios.security;

public interface TokenService {

    String issue(Long usuarioId, String nombreDeUsuario);

    /**
     * @throws TokenInvalidoException si la firma no coincide, el formato es
     *                                incorrecto o el token expiró
     */
    UsuarioAutenticado verify(String token);
}
