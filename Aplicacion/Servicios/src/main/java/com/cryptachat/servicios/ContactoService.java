package com.cryptachat.servicios;

import com.cryptachat.dto.PendingRequestDto;

import java.util.List;

public interface ContactoService {

    void solicitarChat(Long solicitanteId, String nombreDestinatario);

    List<PendingRequestDto> solicitudesPendientes(Long usuarioId);

    void aceptarSolicitud(Long usuarioId, String nombreSolicitante);

    List<String> contactos(Long usuarioId);
}
