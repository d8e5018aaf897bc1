package com.cryptachat.repositorios;

import com.cryptachat.entidades.SolicitudChat;

import java.util.List;

public interface SolicitudChatRepository {

    /**
     * @throws RegistroDuplicadoException si ya existe una solicitud para el mismo par
     */
    SolicitudChat save(SolicitudChat solicitud);

    /**
     * Solicitudes pendientes dirigidas al usuario, con el nombre del solicitante.
     */
    List<SolicitudChat> findPendientesPara(Long solicitadoId);

    /**
     * Marca como aceptada la solicitud pendiente del par indicado.
     *
     * @return {@code false} si no había ninguna solicitud pendiente
     */
    boolean aceptar(Long solicitanteId, Long solicitadoId);

    /**
     * Nombres de los usuarios con los que hay una solicitud aceptada, en
     * cualquiera de las dos direcciones, sin repetidos.
     */
    List<String> findContactos(Long usuarioId);
}
