package com.cryptachat.servicios.entrega;

import com.cryptachat.dto.push.PushFrame;

/**
 * Punto de entrada al canal push en tiempo real.
 */
public interface PushGateway {

    /**
     * Encola el frame para el usuario indicado. Nunca bloquea al llamador: si
     * el usuario no está conectado o el canal está saturado el frame se
     * descarta.
     */
    void submit(Long userId, PushFrame frame);
}
