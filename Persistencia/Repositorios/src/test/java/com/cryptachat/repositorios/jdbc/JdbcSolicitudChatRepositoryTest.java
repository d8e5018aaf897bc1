package com.cryptachat.repositorios.jdbc;

import com.cryptachat.entidades.EstadoSolicitud;
import com.cryptachat.entidades.SolicitudChat;
import com.cryptachat.entidades.Usuario;
import com.cryptachat.repositorios.RegistroDuplicadoException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSolicitudChatRepositoryTest {

    private JdbcSolicitudChatRepository repository;
    private Usuario alice;
    private Usuario bob;
    private Usuario carol;

    @BeforeEach
    void setUp() {
        DataSource dataSource = H2DataSources.nuevaBaseConEsquema();
        JdbcUsuarioRepository usuarios = new JdbcUsuarioRepository(dataSource);
        alice = usuarios.save(new Usuario(null, "alice", "h"));
        bob = usuarios.save(new Usuario(null, "bob", "h"));
        carol = usuarios.save(new Usuario(null, "carol", "h"));
        repository = new JdbcSolicitudChatRepository(dataSource);
    }

    @Test
    void listaPendientesConNombreDelSolicitante() {
        repository.save(new SolicitudChat(alice.getId(), bob.getId(), EstadoSolicitud.PENDING));

        List<SolicitudChat> pendientes = repository.findPendientesPara(bob.getId());

        assertEquals(1, pendientes.size());
        assertEquals("alice", pendientes.get(0).getSolicitanteNombre());
        assertEquals(EstadoSolicitud.PENDING, pendientes.get(0).getEstado());
        assertTrue(repository.findPendientesPara(alice.getId()).isEmpty());
    }

    @Test
    void rechazaSolicitudDuplicadaParaElMismoPar() {
        repository.save(new SolicitudChat(alice.getId(), bob.getId(), EstadoSolicitud.PENDING));

        assertThrows(RegistroDuplicadoException.class,
                () -> repository.save(new SolicitudChat(alice.getId(), bob.getId(), EstadoSolicitud.PENDING)));
    }

    @Test
    void aceptarSoloAfectaSolicitudesPendientes() {
        repository.save(new SolicitudChat(alice.getId(), bob.getId(), EstadoSolicitud.PENDING));

        assertTrue(repository.aceptar(alice.getId(), bob.getId()));
        assertFalse(repository.aceptar(alice.getId(), bob.getId()));
        assertFalse(repository.aceptar(bob.getId(), alice.getId()));
        assertTrue(repository.findPendientesPara(bob.getId()).isEmpty());
    }

    @Test
    void contactosIncluyenAmbasDireccionesSinRepetidos() {
        repository.save(new SolicitudChat(alice.getId(), bob.getId(), EstadoSolicitud.PENDING));
        repository.save(new SolicitudChat(bob.getId(), alice.getId(), EstadoSolicitud.PENDING));
        repository.save(new SolicitudChat(carol.getId(), alice.getId(), EstadoSolicitud.PENDING));
        repository.aceptar(alice.getId(), bob.getId());
        repository.aceptar(bob.getId(), alice.getId());
        repository.aceptar(carol.getId(), alice.getId());

        assertEquals(List.of("bob", "carol"), repository.findContactos(alice.getId()));
        assertEquals(List.of("alice"), repository.findContactos(bob.getId()));
    }
}
