package com.cryptachat.restapi.websocket;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import com.cryptachat.controladores.conexion.ConnectionHub;
import com.cryptachat.controladores.conexion.HubSettings;
import com.cryptachat.servicios.security.UsuarioAutenticado;

/**
 * Entrega cada sesión WebSocket autenticada al hub como una conexión push.
 * El usuario lo deja en los atributos {@link TokenHandshakeInterceptor}.
 */
public class PushWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOGGER = Logger.getLogger(PushWebSocketHandler.class.getName());

    private final ConnectionHub hub;
    private final HubSettings settings;
    private final Map<String, WebSocketFrameStream> streams = new ConcurrentHashMap<>();

    public PushWebSocketHandler(ConnectionHub hub, HubSettings settings) {
        this.hub = hub;
        this.settings = settings;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object attr = session.getAttributes().get(TokenHandshakeInterceptor.USUARIO_ATTR);
        if (!(attr instanceof UsuarioAutenticado usuario)) {
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        WebSocketFrameStream stream = new WebSocketFrameStream(session, settings.maxInboundFrameBytes());
        streams.put(session.getId(), stream);
        LOGGER.info(() -> "Canal WebSocket abierto para " + usuario.nombreDeUsuario() + " (" + session.getId() + ")");
        hub.connect(usuario.id(), stream);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketFrameStream stream = streams.get(session.getId());
        if (stream != null) {
            String payload = message.getPayload();
            stream.onText(payload, payload.getBytes(StandardCharsets.UTF_8).length);
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        WebSocketFrameStream stream = streams.get(session.getId());
        if (stream != null) {
            stream.onPong();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        WebSocketFrameStream stream = streams.get(session.getId());
        if (stream != null) {
            stream.onError(exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketFrameStream stream = streams.remove(session.getId());
        if (stream != null) {
            LOGGER.fine(() -> "Canal WebSocket cerrado " + session.getId() + ": " + status);
            stream.onClosed();
        }
    }
}
