package com.cryptachat.controladores.conexion;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cola FIFO acotada de frames serializados. Solo el hub escribe en ella y solo
 * la bomba de escritura de su conexión la drena. Cerrarla es la señal de
 * cancelación: ya no acepta frames pero los pendientes se siguen entregando.
 */
public class OutboundQueue {

    private final int capacity;
    private final Deque<String> frames = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity debe ser positiva");
        }
        this.capacity = capacity;
    }

    /**
     * No bloquea.
     *
     * @return {@code false} si la cola está llena o cerrada
     */
    public boolean offer(String frame) {
        lock.lock();
        try {
            if (closed || frames.size() >= capacity) {
                return false;
            }
            frames.addLast(frame);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return el siguiente frame, o {@code null} si vence el plazo o si la cola
     * está cerrada y vacía
     */
    public String poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (frames.isEmpty()) {
                if (closed || nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return frames.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} solo en la primera llamada
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }
}
