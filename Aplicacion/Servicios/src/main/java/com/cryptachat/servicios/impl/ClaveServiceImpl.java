package com.cryptachat.servicios.impl;

import com.cryptachat.repositorios.ClavePublicaRepository;
import com.cryptachat.servicios.ClaveService;
import com.cryptachat.servicios.excepciones.RecursoNoEncontradoException;

import java.util.Objects;
import java.util.logging.Logger;

public class ClaveServiceImpl implements ClaveService {

    private static final Logger LOGGER = Logger.getLogger(ClaveServiceImpl.class.getName());

    private final ClavePublicaRepository clavePublicaRepository;

    public ClaveServiceImpl(ClavePublicaRepository clavePublicaRepository) {
        this.clavePublicaRepository = Objects.requireNonNull(clavePublicaRepository, "clavePublicaRepository");
    }

    @Override
    public void subirClave(Long usuarioId, String clavePublica) {
        if (clavePublica == null || clavePublica.isEmpty()) {
            throw new IllegalArgumentException("Missing public_key");
        }
        clavePublicaRepository.upsert(usuarioId, clavePublica);
        LOGGER.fine(() -> "Clave pública actualizada para " + usuarioId);
    }

    @Override
    public String obtenerClave(String nombreDeUsuario) {
        if (nombreDeUsuario == null || nombreDeUsuario.isEmpty()) {
            throw new IllegalArgumentException("Missing username query parameter.");
        }
        return clavePublicaRepository.findByNombreDeUsuario(nombreDeUsuario)
                .orElseThrow(() -> new RecursoNoEncontradoException("User not found or has no public key."));
    }
}
