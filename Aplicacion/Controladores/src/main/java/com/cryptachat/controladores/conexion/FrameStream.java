package com.cryptachat.controladores.conexion;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Flujo bidireccional de frames JSON de una conexión push. {@link #readFrame}
 * solo se invoca desde la bomba de lectura y las escrituras solo desde la
 * bomba de escritura; {@link #close()} puede llamarse desde cualquier hilo.
 */
public interface FrameStream extends Closeable {

    /**
     * Espera el siguiente frame entrante. Un pong o un frame vacío también
     * cuentan como actividad.
     *
     * @return el frame recibido o {@code null} si el par cerró el flujo
     * @throws java.net.SocketTimeoutException si no llega nada dentro del plazo
     * @throws FrameTooLargeException          si el frame excede el tamaño máximo
     */
    String readFrame(Duration timeout) throws IOException;

    void writeFrame(String json) throws IOException;

    void writePing() throws IOException;

    /**
     * Idempotente.
     */
    @Override
    void close();
}
