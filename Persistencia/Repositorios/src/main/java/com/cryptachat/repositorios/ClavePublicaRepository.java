package com.cryptachat.repositorios;

import java.util.Optional;

public interface ClavePublicaRepository {

    /**
     * Guarda la clave pública del usuario, reemplazando la anterior si existía.
     */
    void upsert(Long usuarioId, String clavePublica);

    Optional<String> findByNombreDeUsuario(String nombreDeUsuario);
}
