package com.cryptachat.restapi.websocket;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.cryptachat.controladores.conexion.FrameStream;
import com.cryptachat.controladores.conexion.FrameTooLargeException;

/**
 * Adapta una sesión WebSocket de Spring al flujo de frames del hub. Los
 * eventos entrantes llegan desde los callbacks del contenedor y la bomba de
 * lectura los consume de una cola.
 */
class WebSocketFrameStream implements FrameStream {

    private static final Logger LOGGER = Logger.getLogger(WebSocketFrameStream.class.getName());
    private static final Object FIN = new Object();
    private static final ByteBuffer PING_PAYLOAD = ByteBuffer.wrap(new byte[0]);

    private final WebSocketSession session;
    private final int maxFrameBytes;
    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    WebSocketFrameStream(WebSocketSession session, int maxFrameBytes) {
        this.session = session;
        this.maxFrameBytes = maxFrameBytes;
    }

    void onText(String payload, int sizeInBytes) {
        if (sizeInBytes > maxFrameBytes) {
            inbound.add(new FrameTooLargeException(maxFrameBytes));
        } else {
            inbound.add(payload);
        }
    }

    void onPong() {
        inbound.add("");
    }

    void onClosed() {
        inbound.add(FIN);
    }

    void onError(Throwable error) {
        inbound.add(error instanceof IOException io ? io : new IOException(error));
    }

    @Override
    public String readFrame(Duration timeout) throws IOException {
        Object evento;
        try {
            evento = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Lectura interrumpida", e);
        }
        if (evento == null) {
            throw new SocketTimeoutException("Sin actividad en " + timeout.toSeconds() + "s");
        }
        if (evento == FIN) {
            inbound.add(FIN);
            return null;
        }
        if (evento instanceof IOException error) {
            throw error;
        }
        return (String) evento;
    }

    @Override
    public void writeFrame(String json) throws IOException {
        session.sendMessage(new TextMessage(json));
    }

    @Override
    public void writePing() throws IOException {
        session.sendMessage(new PingMessage(PING_PAYLOAD.duplicate()));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        inbound.add(FIN);
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error cerrando sesión WebSocket " + session.getId(), e);
        }
    }
}
