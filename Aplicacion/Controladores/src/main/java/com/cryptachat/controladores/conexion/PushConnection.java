package com.cryptachat.controladores.conexion;

import com.cryptachat.servicios.metrics.ServerMetrics;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Conexión push de un usuario en línea: su flujo, su cola de salida acotada y
 * las dos bombas que la atienden.
 */
public final class PushConnection {

    private static final Logger LOGGER = Logger.getLogger(PushConnection.class.getName());

    private final Long userId;
    private final FrameStream stream;
    private final OutboundQueue queue;
    private final HubSettings settings;
    private final ConnectionHub hub;
    private final AtomicBoolean released = new AtomicBoolean();

    PushConnection(Long userId, FrameStream stream, HubSettings settings, ConnectionHub hub) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.queue = new OutboundQueue(settings.queueCapacity());
    }

    public Long userId() {
        return userId;
    }

    OutboundQueue queue() {
        return queue;
    }

    void start(Executor executor) {
        executor.execute(this::writePump);
        executor.execute(this::readPump);
    }

    /**
     * Cierra el flujo sin esperar a que se drene la cola.
     */
    void abort() {
        stream.close();
    }

    /**
     * Un ping cada {@code pingInterval}, haya o no frames saliendo.
     */
    void writePump() {
        long intervalo = settings.pingInterval().toNanos();
        long proximoPing = System.nanoTime() + intervalo;
        try {
            while (true) {
                long restante = proximoPing - System.nanoTime();
                if (restante <= 0) {
                    stream.writePing();
                    proximoPing = System.nanoTime() + intervalo;
                    continue;
                }
                String frame = queue.poll(Duration.ofNanos(restante));
                if (frame != null) {
                    stream.writeFrame(frame);
                } else if (queue.isClosed()) {
                    // cerrada y drenada
                    break;
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error escribiendo a usuario " + userId, e);
            ServerMetrics.onSocketError("write", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stream.close();
        }
    }

    void readPump() {
        String motivo = "closed";
        try {
            // el contenido entrante se ignora; solo sirve para detectar actividad
            while (stream.readFrame(settings.idleTimeout()) != null) {
                if (queue.isClosed()) {
                    motivo = "superseded";
                    break;
                }
            }
        } catch (SocketTimeoutException e) {
            motivo = "idle_timeout";
        } catch (FrameTooLargeException e) {
            motivo = "oversize_frame";
        } catch (IOException e) {
            motivo = "read_error";
            ServerMetrics.onSocketError("read", e);
        } finally {
            release();
            stream.close();
        }
        String finalMotivo = motivo;
        LOGGER.fine(() -> "Bomba de lectura de usuario " + userId + " finalizada: " + finalMotivo);
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            hub.unregister(this);
        }
    }

    @Override
    public String toString() {
        return "PushConnection{userId=" + userId + ", pendientes=" + queue.size() + '}';
    }
}
