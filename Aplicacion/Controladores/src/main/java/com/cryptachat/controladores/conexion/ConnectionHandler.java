package com.cryptachat.controladores.conexion;

import com.cryptachat.dto.ApiMessage;
import com.cryptachat.dto.CommandEnvelope;
import com.cryptachat.servicios.metrics.ServerMetrics;
import com.cryptachat.servicios.security.TokenInvalidoException;
import com.cryptachat.servicios.security.TokenService;
import com.cryptachat.servicios.security.UsuarioAutenticado;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Atiende el saludo de un socket del canal push TCP: la primera línea debe ser
 * un comando {@code AUTH} con un token válido. Tras responder {@code AUTH_OK}
 * el flujo pasa al hub.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionHandler.class.getName());

    private final Socket socket;
    private final TokenService tokenService;
    private final ConnectionHub hub;
    private final HubSettings settings;
    private final Runnable onClose;
    private final ObjectMapper mapper = new ObjectMapper();

    public ConnectionHandler(Socket socket,
                             TokenService tokenService,
                             ConnectionHub hub,
                             HubSettings settings,
                             Runnable onClose) {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.tokenService = Objects.requireNonNull(tokenService, "tokenService");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    @Override
    public void run() {
        SocketFrameStream stream;
        try {
            stream = new SocketFrameStream(socket, settings.maxInboundFrameBytes(), onClose);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "No se pudo abrir el flujo del socket", e);
            ServerMetrics.onSocketError("handshake", e);
            closeSocket();
            onClose.run();
            return;
        }
        try {
            String line = stream.readFrame(settings.idleTimeout());
            if (line == null) {
                stream.close();
                return;
            }
            UsuarioAutenticado usuario = authenticate(line);
            stream.writeFrame(mapper.writeValueAsString(new CommandEnvelope(CommandEnvelope.AUTH_OK, authOkPayload(usuario))));
            LOGGER.info(() -> "Canal push TCP autenticado para usuario " + usuario.id() + " desde " + stream.remoteAddress());
            hub.connect(usuario.id(), stream);
        } catch (TokenInvalidoException | IllegalArgumentException e) {
            reject(stream, e.getMessage());
        } catch (JsonProcessingException e) {
            reject(stream, "Formato JSON inválido");
        } catch (FrameTooLargeException e) {
            reject(stream, "Frame demasiado grande");
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Conexión cerrada durante el saludo: {0}", e.getMessage());
            stream.close();
        }
    }

    private UsuarioAutenticado authenticate(String line) throws JsonProcessingException {
        JsonNode node = mapper.readTree(line);
        String command = node != null && node.hasNonNull("command")
                ? node.get("command").asText().toUpperCase(Locale.ROOT)
                : "";
        if (!CommandEnvelope.AUTH.equals(command)) {
            throw new IllegalArgumentException("Se esperaba el comando AUTH");
        }
        JsonNode payload = node.get("payload");
        String token = payload != null && payload.hasNonNull("token") ? payload.get("token").asText() : null;
        return tokenService.verify(token);
    }

    private Map<String, Object> authOkPayload(UsuarioAutenticado usuario) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", usuario.id());
        payload.put("username", usuario.nombreDeUsuario());
        return payload;
    }

    private void reject(SocketFrameStream stream, String message) {
        ServerMetrics.onPushConnectionRejected("auth_failed");
        LOGGER.info(() -> "Saludo rechazado desde " + stream.remoteAddress() + ": " + message);
        try {
            stream.writeFrame(mapper.writeValueAsString(new CommandEnvelope(CommandEnvelope.ERROR, new ApiMessage(message))));
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "No se pudo notificar el rechazo", e);
        } finally {
            stream.close();
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error cerrando socket", e);
        }
    }
}
