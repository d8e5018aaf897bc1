package com.cryptachat.servicios;

public interface ClaveService {

    void subirClave(Long usuarioId, String clavePublica);

    String obtenerClave(String nombreDeUsuario);
}
