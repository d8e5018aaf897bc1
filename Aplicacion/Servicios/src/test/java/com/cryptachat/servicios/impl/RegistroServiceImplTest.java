package com.cryptachat.servicios.impl;

import com.cryptachat.servicios.InMemoryRepositories;
import com.cryptachat.servicios.excepciones.ConflictoException;
import com.cryptachat.servicios.excepciones.CredencialesInvalidasException;
import com.cryptachat.servicios.security.HmacTokenService;
import com.cryptachat.servicios.security.Sha256PasswordHasher;
import com.cryptachat.servicios.security.UsuarioAutenticado;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegistroServiceImplTest {

    private InMemoryRepositories.Usuarios usuarios;
    private HmacTokenService tokenService;
    private RegistroServiceImpl service;

    @BeforeEach
    void setUp() {
        usuarios = new InMemoryRepositories.Usuarios();
        tokenService = new HmacTokenService("secreto", Duration.ofHours(24));
        service = new RegistroServiceImpl(usuarios, new Sha256PasswordHasher("pimienta"), tokenService);
    }

    @Test
    void registraEIniciaSesion() {
        Long id = service.registrar("alice", "clave").getId();

        assertNotEquals("clave", usuarios.findById(id).orElseThrow().getContrasenia());
        UsuarioAutenticado usuario = tokenService.verify(service.iniciarSesion("alice", "clave"));
        assertEquals(id, usuario.id());
        assertEquals("alice", usuario.nombreDeUsuario());
    }

    @Test
    void nombreDuplicadoEsConflicto() {
        service.registrar("alice", "clave");

        assertThrows(ConflictoException.class, () -> service.registrar("alice", "otra"));
    }

    @Test
    void camposVaciosSonInvalidos() {
        assertThrows(IllegalArgumentException.class, () -> service.registrar("", "clave"));
        assertThrows(IllegalArgumentException.class, () -> service.registrar("alice", null));
    }

    @Test
    void credencialesIncorrectasSeRechazan() {
        service.registrar("alice", "clave");

        CredencialesInvalidasException ex = assertThrows(CredencialesInvalidasException.class,
                () -> service.iniciarSesion("alice", "mala"));
        assertEquals("Could not verify! Check username/password.", ex.getMessage());
        assertThrows(CredencialesInvalidasException.class, () -> service.iniciarSesion("nadie", "clave"));
        assertThrows(CredencialesInvalidasException.class, () -> service.iniciarSesion("", ""));
    }
}
