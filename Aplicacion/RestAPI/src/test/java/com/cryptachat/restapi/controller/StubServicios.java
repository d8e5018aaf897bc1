package com.cryptachat.restapi.controller;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cryptachat.dto.MessageDto;
import com.cryptachat.dto.PendingRequestDto;
import com.cryptachat.entidades.Usuario;
import com.cryptachat.servicios.ClaveService;
import com.cryptachat.servicios.ContactoService;
import com.cryptachat.servicios.MensajeriaService;
import com.cryptachat.servicios.RegistroService;
import com.cryptachat.servicios.excepciones.ConflictoException;
import com.cryptachat.servicios.excepciones.CredencialesInvalidasException;
import com.cryptachat.servicios.excepciones.RecursoNoEncontradoException;

/**
 * Servicios mínimos en memoria que registran las llamadas recibidas.
 */
final class StubServicios {

    private StubServicios() {
    }

    static final class Registro implements RegistroService {
        final Map<String, String> usuarios = new HashMap<>();

        @Override
        public Usuario registrar(String nombreDeUsuario, String contrasenia) {
            if (nombreDeUsuario == null || contrasenia == null) {
                throw new IllegalArgumentException("Missing username or password");
            }
            if (usuarios.putIfAbsent(nombreDeUsuario, contrasenia) != null) {
                throw new ConflictoException("Username already exists.");
            }
            return new Usuario((long) usuarios.size(), nombreDeUsuario, contrasenia);
        }

        @Override
        public String iniciarSesion(String nombreDeUsuario, String contrasenia) {
            if (contrasenia == null || !contrasenia.equals(usuarios.get(nombreDeUsuario))) {
                throw new CredencialesInvalidasException("Could not verify! Check username/password.");
            }
            return "token-" + nombreDeUsuario;
        }
    }

    static final class Claves implements ClaveService {
        final Map<Long, String> subidas = new HashMap<>();

        @Override
        public void subirClave(Long usuarioId, String clavePublica) {
            if (clavePublica == null) {
                throw new IllegalArgumentException("Missing public_key");
            }
            subidas.put(usuarioId, clavePublica);
        }

        @Override
        public String obtenerClave(String nombreDeUsuario) {
            if (nombreDeUsuario == null) {
                throw new IllegalArgumentException("Missing username query parameter.");
            }
            if (!"bob".equals(nombreDeUsuario)) {
                throw new RecursoNoEncontradoException("User not found or has no public key.");
            }
            return "PEM-bob";
        }
    }

    static final class Contactos implements ContactoService {
        final List<String> llamadas = new ArrayList<>();

        @Override
        public void solicitarChat(Long solicitanteId, String nombreDestinatario) {
            llamadas.add("solicitar:" + solicitanteId + ":" + nombreDestinatario);
        }

        @Override
        public List<PendingRequestDto> solicitudesPendientes(Long usuarioId) {
            return List.of(new PendingRequestDto("alice", "pending"));
        }

        @Override
        public void aceptarSolicitud(Long usuarioId, String nombreSolicitante) {
            llamadas.add("aceptar:" + usuarioId + ":" + nombreSolicitante);
        }

        @Override
        public List<String> contactos(Long usuarioId) {
            return List.of("alice", "carol");
        }
    }

    static final class Mensajeria implements MensajeriaService {
        final List<String> llamadas = new ArrayList<>();

        @Override
        public MessageDto enviarMensaje(Long emisorId, String nombreDestinatario, String blobEmisor, String blobReceptor) {
            if (nombreDestinatario == null || blobEmisor == null || blobReceptor == null) {
                throw new IllegalArgumentException("Missing recipient_username, sender_blob, or recipient_blob");
            }
            llamadas.add("enviar:" + emisorId + ":" + nombreDestinatario);
            return new MessageDto(1L, emisorId, 2L, null, "alice", blobEmisor);
        }

        @Override
        public List<MessageDto> obtenerMensajes(Long lectorId, String nombreContraparte, long sinceId) {
            llamadas.add("obtener:" + lectorId + ":" + nombreContraparte + ":" + sinceId);
            return List.of(new MessageDto(5L, 2L, lectorId, null, "bob", "para-lector"));
        }
    }
}
