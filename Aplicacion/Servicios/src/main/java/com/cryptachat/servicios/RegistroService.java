package com.cryptachat.servicios;

import com.cryptachat.entidades.Usuario;

public interface RegistroService {

    Usuario registrar(String nombreDeUsuario, String contrasenia);

    /**
     * Verifica las credenciales y emite un token de sesión.
     */
    String iniciarSesion(String nombreDeUsuario, String contrasenia);
}
