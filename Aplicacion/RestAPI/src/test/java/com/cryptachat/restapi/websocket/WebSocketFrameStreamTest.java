package com.cryptachat.restapi.websocket;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;

import com.cryptachat.controladores.conexion.FrameTooLargeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSocketFrameStreamTest {

    private static final Duration CORTO = Duration.ofMillis(50);
    private static final Duration ESPERA = Duration.ofSeconds(1);

    private final StubWebSocketSession session = new StubWebSocketSession("s-1");
    private final WebSocketFrameStream stream = new WebSocketFrameStream(session, 16);

    @Test
    void sinActividadVenceElPlazo() {
        assertThrows(SocketTimeoutException.class, () -> stream.readFrame(CORTO));
    }

    @Test
    void entregaTextoYPongComoActividad() throws Exception {
        stream.onText("{\"type\":\"pong\"}", 15);
        stream.onPong();

        assertEquals("{\"type\":\"pong\"}", stream.readFrame(ESPERA));
        assertEquals("", stream.readFrame(ESPERA));
    }

    @Test
    void trasElCierreDelParTodasLasLecturasDevuelvenNull() throws Exception {
        stream.onClosed();

        assertNull(stream.readFrame(ESPERA));
        assertNull(stream.readFrame(ESPERA));
    }

    @Test
    void frameDemasiadoGrandeFalla() {
        stream.onText("x".repeat(32), 32);

        FrameTooLargeException error = assertThrows(FrameTooLargeException.class, () -> stream.readFrame(ESPERA));
        assertTrue(error.getMessage().contains("16"));
    }

    @Test
    void errorDeTransporteSeConvierteEnIOException() {
        IllegalStateException causa = new IllegalStateException("transporte roto");
        stream.onError(causa);

        IOException error = assertThrows(IOException.class, () -> stream.readFrame(ESPERA));
        assertSame(causa, error.getCause());
    }

    @Test
    void escribeTextoYPing() throws Exception {
        stream.writeFrame("{\"id\":1}");
        stream.writePing();

        WebSocketMessage<?> texto = session.nextSent(1000);
        assertInstanceOf(TextMessage.class, texto);
        assertEquals("{\"id\":1}", ((TextMessage) texto).getPayload());
        assertInstanceOf(PingMessage.class, session.nextSent(1000));
    }

    @Test
    void cerrarEsIdempotente() throws Exception {
        stream.close();
        stream.close();

        assertEquals(1, session.closeCalls());
        assertFalse(session.isOpen());
        assertNull(stream.readFrame(ESPERA));
    }
}
