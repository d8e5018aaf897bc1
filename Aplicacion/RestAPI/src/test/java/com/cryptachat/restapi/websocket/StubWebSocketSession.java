package com.cryptachat.restapi.websocket;

import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Sesión en memoria: guarda lo enviado y cuenta los cierres.
 */
class StubWebSocketSession implements WebSocketSession {

    private final String id;
    private final Map<String, Object> attributes = new HashMap<>();
    private final BlockingQueue<WebSocketMessage<?>> sent = new LinkedBlockingQueue<>();
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile boolean open = true;
    private volatile CloseStatus closeStatus;
    private volatile Consumer<WebSocketMessage<?>> onSend = message -> { };

    StubWebSocketSession(String id) {
        this.id = id;
    }

    void onSend(Consumer<WebSocketMessage<?>> listener) {
        this.onSend = listener;
    }

    WebSocketMessage<?> nextSent(long millis) throws InterruptedException {
        return sent.poll(millis, TimeUnit.MILLISECONDS);
    }

    int closeCalls() {
        return closeCalls.get();
    }

    CloseStatus closeStatus() {
        return closeStatus;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public URI getUri() {
        return URI.create("ws://localhost/ws");
    }

    @Override
    public HttpHeaders getHandshakeHeaders() {
        return new HttpHeaders();
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Principal getPrincipal() {
        return null;
    }

    @Override
    public InetSocketAddress getLocalAddress() {
        return null;
    }

    @Override
    public InetSocketAddress getRemoteAddress() {
        return null;
    }

    @Override
    public String getAcceptedProtocol() {
        return null;
    }

    @Override
    public void setTextMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getTextMessageSizeLimit() {
        return 8192;
    }

    @Override
    public void setBinaryMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getBinaryMessageSizeLimit() {
        return 8192;
    }

    @Override
    public List<WebSocketExtension> getExtensions() {
        return List.of();
    }

    @Override
    public void sendMessage(WebSocketMessage<?> message) {
        sent.add(message);
        onSend.accept(message);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    @Override
    public void close(CloseStatus status) {
        closeCalls.incrementAndGet();
        closeStatus = status;
        open = false;
    }
}
