package com.cryptachat.repositorios;

import com.cryptachat.entidades.Usuario;

import java.util.Optional;

public interface UsuarioRepository {

    /**
     * Inserta un usuario nuevo y le asigna su identificador.
     *
     * @throws RegistroDuplicadoException si el nombre de usuario ya existe
     */
    Usuario save(Usuario usuario);

    Optional<Usuario> findById(Long id);

    Optional<Usuario> findByNombreDeUsuario(String nombreDeUsuario);
}
