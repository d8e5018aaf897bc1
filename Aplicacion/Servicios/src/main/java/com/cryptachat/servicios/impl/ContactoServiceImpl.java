package com.cryptachat.servicios.impl;

import com.cryptachat.dto.PendingRequestDto;
import com.cryptachat.entidades.EstadoSolicitud;
import com.cryptachat.entidades.SolicitudChat;
import com.cryptachat.entidades.Usuario;
import com.cryptachat.repositorios.RegistroDuplicadoException;
import com.cryptachat.repositorios.SolicitudChatRepository;
import com.cryptachat.repositorios.UsuarioRepository;
import com.cryptachat.servicios.ContactoService;
import com.cryptachat.servicios.excepciones.ConflictoException;
import com.cryptachat.servicios.excepciones.RecursoNoEncontradoException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class ContactoServiceImpl implements ContactoService {

    private static final Logger LOGGER = Logger.getLogger(ContactoServiceImpl.class.getName());

    private final UsuarioRepository usuarioRepository;
    private final SolicitudChatRepository solicitudChatRepository;

    public ContactoServiceImpl(UsuarioRepository usuarioRepository, SolicitudChatRepository solicitudChatRepository) {
        this.usuarioRepository = Objects.requireNonNull(usuarioRepository, "usuarioRepository");
        this.solicitudChatRepository = Objects.requireNonNull(solicitudChatRepository, "solicitudChatRepository");
    }

    @Override
    public void solicitarChat(Long solicitanteId, String nombreDestinatario) {
        if (nombreDestinatario == null || nombreDestinatario.isEmpty()) {
            throw new IllegalArgumentException("Missing recipient_username");
        }
        Usuario destinatario = usuarioRepository.findByNombreDeUsuario(nombreDestinatario)
                .orElseThrow(() -> new RecursoNoEncontradoException("Recipient user not found."));
        if (destinatario.getId().equals(solicitanteId)) {
            throw new IllegalArgumentException("Cannot send chat request to yourself.");
        }
        try {
            solicitudChatRepository.save(new SolicitudChat(solicitanteId, destinatario.getId(), EstadoSolicitud.PENDING));
        } catch (RegistroDuplicadoException e) {
            throw new ConflictoException("Chat request already pending or accepted.");
        }
        LOGGER.info(() -> "Solicitud de chat de " + solicitanteId + " a " + destinatario.getId());
    }

    @Override
    public List<PendingRequestDto> solicitudesPendientes(Long usuarioId) {
        return solicitudChatRepository.findPendientesPara(usuarioId).stream()
                .map(s -> new PendingRequestDto(s.getSolicitanteNombre(), s.getEstado().valor()))
                .collect(Collectors.toList());
    }

    @Override
    public void aceptarSolicitud(Long usuarioId, String nombreSolicitante) {
        if (nombreSolicitante == null || nombreSolicitante.isEmpty()) {
            throw new IllegalArgumentException("Missing requester_username");
        }
        Usuario solicitante = usuarioRepository.findByNombreDeUsuario(nombreSolicitante)
                .orElseThrow(() -> new RecursoNoEncontradoException("No pending request found from that user."));
        if (!solicitudChatRepository.aceptar(solicitante.getId(), usuarioId)) {
            throw new RecursoNoEncontradoException("No pending request found from that user.");
        }
        LOGGER.info(() -> "Solicitud de chat de " + solicitante.getId() + " aceptada por " + usuarioId);
    }

    @Override
    public List<String> contactos(Long usuarioId) {
        return solicitudChatRepository.findContactos(usuarioId);
    }
}
