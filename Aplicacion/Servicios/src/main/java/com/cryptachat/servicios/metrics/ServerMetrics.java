package com.cryptachat.servicios.metrics;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.exporter.HTTPServer;

import java.io.IOException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Centraliza las metricas del servidor y expone un endpoint HTTP en formato
 * Prometheus.
 */
public final class ServerMetrics {

    private static final Logger LOGGER = Logger.getLogger(ServerMetrics.class.getName());

    private static volatile HTTPServer httpServer;

    // --- Canal push ---

    private static final Gauge pushActiveConnections = Gauge.build()
        .name("cryptachat_push_active_connections")
        .help("Conexiones push registradas en el hub.")
        .register();

    private static final Counter pushConnectionEvents = Counter.build()
        .name("cryptachat_push_connection_events_total")
        .help("Eventos de ciclo de vida de conexiones push.")
        .labelNames("event")
        .register();

    private static final Counter pushDropped = Counter.build()
        .name("cryptachat_push_dropped_total")
        .help("Frames push descartados por motivo.")
        .labelNames("reason")
        .register();

    private static final Counter pushDelivered = Counter.build()
        .name("cryptachat_push_frames_enqueued_total")
        .help("Frames push encolados hacia una conexion activa.")
        .register();

    private static final Counter socketErrors = Counter.build()
        .name("cryptachat_push_socket_errors_total")
        .help("Errores de socket en las conexiones push.")
        .labelNames("phase", "exception")
        .register();

    // --- Mensajeria / autenticacion ---

    private static final Counter messagesStored = Counter.build()
        .name("cryptachat_messages_stored_total")
        .help("Mensajes anexados al log.")
        .register();

    private static final Counter loginAttempts = Counter.build()
        .name("cryptachat_login_attempts_total")
        .help("Intentos de autenticacion por resultado.")
        .labelNames("result")
        .register();

    private ServerMetrics() {
    }

    /**
     * Arranca el servidor HTTP de metricas Prometheus en el puerto indicado.
     * Es idempotente: llamar varias veces reutiliza la misma instancia.
     */
    public static synchronized void startMetricsServer(int port) {
        if (httpServer != null) {
            return;
        }
        try {
            httpServer = new HTTPServer(port, true);
            LOGGER.info(() -> "Servidor de metricas Prometheus escuchando en puerto " + port);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "No se pudo iniciar el servidor de metricas en el puerto " + port, e);
        }
    }

    public static synchronized void stopMetricsServer() {
        if (httpServer != null) {
            httpServer.close();
            httpServer = null;
        }
    }

    // --- Canal push ---

    public static void onPushConnectionRegistered() {
        pushActiveConnections.inc();
        pushConnectionEvents.labels("registered").inc();
    }

    public static void onPushConnectionUnregistered() {
        pushActiveConnections.dec();
        pushConnectionEvents.labels("unregistered").inc();
    }

    public static void onPushConnectionSuperseded() {
        pushConnectionEvents.labels("superseded").inc();
    }

    public static void onPushConnectionRejected(String reason) {
        pushConnectionEvents.labels(normalizeLabel(reason)).inc();
    }

    public static void recordPushDropped(String reason) {
        pushDropped.labels(normalizeLabel(reason)).inc();
    }

    public static double pushDroppedCount(String reason) {
        return pushDropped.labels(normalizeLabel(reason)).get();
    }

    public static void recordPushEnqueued() {
        pushDelivered.inc();
    }

    public static void onSocketError(String phase, Exception exception) {
        String exName = exception != null ? exception.getClass().getSimpleName() : "Unknown";
        socketErrors.labels(normalizeLabel(phase), exName).inc();
    }

    // --- Mensajeria / autenticacion ---

    public static void recordMessageStored() {
        messagesStored.inc();
    }

    public static void recordLoginSuccess() {
        loginAttempts.labels("success").inc();
    }

    public static void recordLoginFailure() {
        loginAttempts.labels("failure").inc();
    }

    // --- Utilidades ---

    private static String normalizeLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return "unknown";
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        normalized = normalized.replaceAll("[^a-z0-9_]+", "_");
        if (normalized.isEmpty()) {
            return "unknown";
        }
        if (normalized.length() > 64) {
            return normalized.substring(0, 64);
        }
        return normalized;
    }
}
