package com.cryptachat.repositorios.jdbc;

import com.cryptachat.entidades.Mensaje;
import com.cryptachat.entidades.Usuario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcMensajeRepositoryTest {

    private JdbcMensajeRepository repository;
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
        repository = new JdbcMensajeRepository(dataSource);
    }

    @Test
    void appendAsignaIdentificadorYMarcaDeTiempo() {
        Mensaje guardado = repository.append(new Mensaje(alice.getId(), bob.getId(), "para-alice", "para-bob"));

        assertNotNull(guardado.getId());
        assertNotNull(guardado.getTimeStamp());
        assertEquals(0, guardado.getTimeStamp().getNano() % 1_000_000);
    }

    @Test
    void conversacionFiltraPorParYSinceIdEnOrden() {
        LocalDateTime base = LocalDateTime.of(2024, 1, 1, 10, 0);
        Mensaje m1 = conFecha(new Mensaje(alice.getId(), bob.getId(), "a1", "b1"), base);
        Mensaje m2 = conFecha(new Mensaje(bob.getId(), alice.getId(), "b2", "a2"), base.plusSeconds(1));
        Mensaje m4 = conFecha(new Mensaje(alice.getId(), bob.getId(), "a4", "b4"), base.plusSeconds(3));
        repository.append(m1);
        repository.append(m2);
        repository.append(new Mensaje(alice.getId(), carol.getId(), "a3", "c3"));
        repository.append(m4);

        List<Mensaje> todos = repository.findConversation(bob.getId(), alice.getId(), 0);
        assertEquals(List.of(m1.getId(), m2.getId(), m4.getId()), todos.stream().map(Mensaje::getId).toList());
        assertEquals("alice", todos.get(0).getEmisorNombre());
        assertEquals("bob", todos.get(1).getEmisorNombre());

        List<Mensaje> desde = repository.findConversation(alice.getId(), bob.getId(), m2.getId());
        assertEquals(1, desde.size());
        assertEquals(m4.getId(), desde.get(0).getId());
        assertEquals("a4", desde.get(0).blobPara(alice.getId()));
        assertEquals("b4", desde.get(0).blobPara(bob.getId()));
    }

    @Test
    void conversacionSinMensajesEsVacia() {
        assertTrue(repository.findConversation(bob.getId(), carol.getId(), 0).isEmpty());
    }

    private Mensaje conFecha(Mensaje mensaje, LocalDateTime fecha) {
        mensaje.setTimeStamp(fecha);
        return mensaje;
    }
}
