package com.cryptachat.controladores.conexion;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundQueueTest {

    @Test
    void rechazaCuandoEstaLlena() throws Exception {
        OutboundQueue queue = new OutboundQueue(2);

        assertTrue(queue.offer("a"));
        assertTrue(queue.offer("b"));
        assertFalse(queue.offer("c"));
        assertEquals("a", queue.poll(Duration.ofMillis(10)));
        assertTrue(queue.offer("c"));
        assertEquals("b", queue.poll(Duration.ofMillis(10)));
        assertEquals("c", queue.poll(Duration.ofMillis(10)));
    }

    @Test
    void cerradaEntregaPendientesYLuegoNull() throws Exception {
        OutboundQueue queue = new OutboundQueue(4);
        queue.offer("a");

        assertTrue(queue.close());
        assertFalse(queue.close());
        assertFalse(queue.offer("b"));
        assertEquals("a", queue.poll(Duration.ofSeconds(1)));
        assertNull(queue.poll(Duration.ofSeconds(1)));
        assertTrue(queue.isClosed());
    }

    @Test
    void pollVenceSinElementos() throws Exception {
        OutboundQueue queue = new OutboundQueue(1);

        assertNull(queue.poll(Duration.ofMillis(20)));
        assertFalse(queue.isClosed());
    }

    @Test
    void cerrarDespiertaAlConsumidor() throws Exception {
        OutboundQueue queue = new OutboundQueue(1);
        CompletableFuture<String> consumidor = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.poll(Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        queue.close();

        assertNull(consumidor.get(2, TimeUnit.SECONDS));
    }

    @Test
    void capacidadDebeSerPositiva() {
        assertThrows(IllegalArgumentException.class, () -> new OutboundQueue(0));
    }
}
