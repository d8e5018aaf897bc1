package com.cryptachat.servicios.entrega;

import com.cryptachat.dto.push.MessageFrame;
import com.cryptachat.dto.push.PushFrame;
import com.cryptachat.entidades.Mensaje;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryGatewayTest {

    @Test
    void entregaAlReceptorSuBlob() {
        List<Long> destinos = new ArrayList<>();
        List<PushFrame> frames = new ArrayList<>();
        DeliveryGateway gateway = new DeliveryGateway((userId, frame) -> {
            destinos.add(userId);
            frames.add(frame);
        });

        Mensaje mensaje = new Mensaje(1L, 2L, "blob-emisor", "blob-receptor");
        mensaje.setId(10L);
        mensaje.setTimeStamp(LocalDateTime.of(2024, 1, 1, 12, 0));
        mensaje.setEmisorNombre("alice");
        gateway.deliver(mensaje);

        assertEquals(List.of(2L), destinos);
        MessageFrame frame = assertInstanceOf(MessageFrame.class, frames.get(0));
        assertEquals(10L, frame.getId());
        assertEquals(1L, frame.getSenderId());
        assertEquals(2L, frame.getRecipientId());
        assertEquals("alice", frame.getSenderUsername());
        assertEquals("blob-receptor", frame.getEncryptedBlob());
    }

    @Test
    void nuncaPropagaErroresDelCanal() {
        DeliveryGateway gateway = new DeliveryGateway((userId, frame) -> {
            throw new IllegalStateException("canal caido");
        });
        Mensaje mensaje = new Mensaje(1L, 2L, "a", "b");
        mensaje.setId(1L);

        assertDoesNotThrow(() -> gateway.deliver(mensaje));
    }

    @Test
    void omiteMensajesSinPersistir() {
        List<PushFrame> frames = new ArrayList<>();
        DeliveryGateway gateway = new DeliveryGateway((userId, frame) -> frames.add(frame));

        gateway.deliver(new Mensaje(1L, 2L, "a", "b"));
        gateway.deliver(null);

        assertTrue(frames.isEmpty());
    }
}
