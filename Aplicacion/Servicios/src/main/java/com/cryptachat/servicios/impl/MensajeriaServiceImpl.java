package com.cryptachat.servicios.impl;

import com.cryptachat.dto.MessageDto;
import com.cryptachat.entidades.Mensaje;
import com.cryptachat.entidades.Usuario;
import com.cryptachat.repositorios.MensajeRepository;
import com.cryptachat.repositorios.UsuarioRepository;
import com.cryptachat.servicios.MensajeriaService;
import com.cryptachat.servicios.entrega.DeliveryGateway;
import com.cryptachat.servicios.excepciones.RecursoNoEncontradoException;
import com.cryptachat.servicios.metrics.ServerMetrics;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class MensajeriaServiceImpl implements MensajeriaService {

    private static final Logger LOGGER = Logger.getLogger(MensajeriaServiceImpl.class.getName());

    private final UsuarioRepository usuarioRepository;
    private final MensajeRepository mensajeRepository;
    private final DeliveryGateway deliveryGateway;

    public MensajeriaServiceImpl(UsuarioRepository usuarioRepository,
                                 MensajeRepository mensajeRepository,
                                 DeliveryGateway deliveryGateway) {
        this.usuarioRepository = Objects.requireNonNull(usuarioRepository, "usuarioRepository");
        this.mensajeRepository = Objects.requireNonNull(mensajeRepository, "mensajeRepository");
        this.deliveryGateway = Objects.requireNonNull(deliveryGateway, "deliveryGateway");
    }

    @Override
    public MessageDto enviarMensaje(Long emisorId, String nombreDestinatario, String blobEmisor, String blobReceptor) {
        if (isEmpty(nombreDestinatario) || isEmpty(blobEmisor) || isEmpty(blobReceptor)) {
            throw new IllegalArgumentException("Missing recipient_username, sender_blob, or recipient_blob");
        }
        Usuario destinatario = usuarioRepository.findByNombreDeUsuario(nombreDestinatario)
                .orElseThrow(() -> new RecursoNoEncontradoException("Recipient user not found."));

        Mensaje stored = mensajeRepository.append(new Mensaje(emisorId, destinatario.getId(), blobEmisor, blobReceptor));
        ServerMetrics.recordMessageStored();
        if (stored.getEmisorNombre() == null) {
            usuarioRepository.findById(emisorId).ifPresent(u -> stored.setEmisorNombre(u.getNombreDeUsuario()));
        }
        LOGGER.fine(() -> "Mensaje " + stored.getId() + " anexado de " + emisorId + " a " + stored.getReceptor());

        // Solo se notifica tras persistir: un push perdido se recupera sondeando
        deliveryGateway.deliver(stored);
        return toDto(stored, emisorId);
    }

    @Override
    public List<MessageDto> obtenerMensajes(Long lectorId, String nombreContraparte, long sinceId) {
        if (isEmpty(nombreContraparte)) {
            throw new IllegalArgumentException("Missing username query parameter.");
        }
        Usuario contraparte = usuarioRepository.findByNombreDeUsuario(nombreContraparte)
                .orElseThrow(() -> new RecursoNoEncontradoException("Partner user not found."));
        return mensajeRepository.findConversation(lectorId, contraparte.getId(), sinceId).stream()
                .map(m -> toDto(m, lectorId))
                .collect(Collectors.toList());
    }

    private MessageDto toDto(Mensaje mensaje, Long lectorId) {
        return new MessageDto(
                mensaje.getId(),
                mensaje.getEmisor(),
                mensaje.getReceptor(),
                mensaje.getTimeStamp(),
                mensaje.getEmisorNombre(),
                mensaje.blobPara(lectorId));
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
