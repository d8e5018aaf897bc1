package com.cryptachat.controladores.conexion;

import java.time.Duration;
import java.util.Objects;

/**
 * Parámetros del canal push.
 *
 * @param queueCapacity        frames pendientes por conexión antes de desconectarla
 * @param pushBacklog          trabajos push pendientes en el hub antes de descartar
 * @param pingInterval         intervalo de keepalive cuando la conexión está ociosa
 * @param idleTimeout          silencio máximo del par antes de cerrar la conexión
 * @param maxInboundFrameBytes tamaño máximo de un frame entrante
 */
public record HubSettings(int queueCapacity,
                          int pushBacklog,
                          Duration pingInterval,
                          Duration idleTimeout,
                          int maxInboundFrameBytes) {

    public static final int DEFAULT_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_PUSH_BACKLOG = 1024;
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(54);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_INBOUND_FRAME_BYTES = 512;

    public HubSettings {
        if (queueCapacity <= 0 || pushBacklog <= 0 || maxInboundFrameBytes <= 0) {
            throw new IllegalArgumentException("Los límites del hub deben ser positivos");
        }
        Objects.requireNonNull(pingInterval, "pingInterval");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (pingInterval.isZero() || pingInterval.isNegative() || pingInterval.compareTo(idleTimeout) >= 0) {
            throw new IllegalArgumentException("pingInterval debe ser positivo y menor que idleTimeout");
        }
    }

    public static HubSettings defaults() {
        return new HubSettings(DEFAULT_QUEUE_CAPACITY, DEFAULT_PUSH_BACKLOG, DEFAULT_PING_INTERVAL,
                DEFAULT_IDLE_TIMEOUT, DEFAULT_MAX_INBOUND_FRAME_BYTES);
    }
}
