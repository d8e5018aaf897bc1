package com.cryptachat.repositorios;

import com.cryptachat.entidades.Mensaje;

import java.util.List;

/**
 * Log de mensajes duradero y de solo anexado. Los identificadores crecen de
 * forma monótona, lo que permite a los clientes sondear con una marca
 * {@code sinceId}.
 */
public interface MensajeRepository {

    /**
     * Anexa el mensaje al log y devuelve la misma instancia con su
     * identificador y su marca de tiempo asignados.
     */
    Mensaje append(Mensaje mensaje);

    /**
     * Mensajes entre ambos usuarios con identificador mayor que {@code sinceId},
     * en orden ascendente de marca de tiempo (y de identificador en caso de
     * empate), con el nombre del emisor resuelto.
     */
    List<Mensaje> findConversation(Long usuarioA, Long usuarioB, long sinceId);
}
