package com.cryptachat.servicios.impl;

import com.cryptachat.entidades.Usuario;
import com.cryptachat.repositorios.RegistroDuplicadoException;
import com.cryptachat.repositorios.UsuarioRepository;
import com.cryptachat.servicios.RegistroService;
import com.cryptachat.servicios.excepciones.ConflictoException;
import com.cryptachat.servicios.excepciones.CredencialesInvalidasException;
import com.cryptachat.servicios.metrics.ServerMetrics;
import com.cryptachat.servicios.security.PasswordHasher;
import com.cryptachat.servicios.security.TokenService;

import java.util.Objects;
import java.util.logging.Logger;

public class RegistroServiceImpl implements RegistroService {

    private static final Logger LOGGER = Logger.getLogger(RegistroServiceImpl.class.getName());

    private static final String CREDENCIALES_INVALIDAS = "Could not verify! Check username/password.";

    private final UsuarioRepository usuarioRepository;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;

    public RegistroServiceImpl(UsuarioRepository usuarioRepository,
                               PasswordHasher passwordHasher,
                               TokenService tokenService) {
        this.usuarioRepository = Objects.requireNonNull(usuarioRepository, "usuarioRepository");
        this.passwordHasher = Objects.requireNonNull(passwordHasher, "passwordHasher");
        this.tokenService = Objects.requireNonNull(tokenService, "tokenService");
    }

    @Override
    public Usuario registrar(String nombreDeUsuario, String contrasenia) {
        if (isBlank(nombreDeUsuario) || isBlank(contrasenia)) {
            throw new IllegalArgumentException("Missing username or password");
        }
        Usuario usuario = new Usuario(null, nombreDeUsuario, passwordHasher.hash(contrasenia));
        try {
            Usuario saved = usuarioRepository.save(usuario);
            LOGGER.info(() -> "Usuario registrado: " + saved.getId());
            return saved;
        } catch (RegistroDuplicadoException e) {
            throw new ConflictoException("Username already exists.");
        }
    }

    @Override
    public String iniciarSesion(String nombreDeUsuario, String contrasenia) {
        if (isBlank(nombreDeUsuario) || isBlank(contrasenia)) {
            ServerMetrics.recordLoginFailure();
            throw new CredencialesInvalidasException("Could not verify");
        }
        Usuario usuario = usuarioRepository.findByNombreDeUsuario(nombreDeUsuario)
                .filter(u -> passwordHasher.matches(contrasenia, u.getContrasenia()))
                .orElseThrow(() -> {
                    ServerMetrics.recordLoginFailure();
                    return new CredencialesInvalidasException(CREDENCIALES_INVALIDAS);
                });
        ServerMetrics.recordLoginSuccess();
        LOGGER.fine(() -> "Inicio de sesión de " + usuario.getId());
        return tokenService.issue(usuario.getId(), usuario.getNombreDeUsuario());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
