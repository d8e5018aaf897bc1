package com.cryptachat.servicios;

import com.cryptachat.dto.MessageDto;

import java.util.List;

public interface MensajeriaService {

    /**
     * Anexa el mensaje al log y, una vez persistido, lo notifica al receptor.
     */
    MessageDto enviarMensaje(Long emisorId, String nombreDestinatario, String blobEmisor, String blobReceptor);

    List<MessageDto> obtenerMensajes(Long lectorId, String nombreContraparte, long sinceId);
}
