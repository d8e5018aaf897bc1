package com.cryptachat.controladores.conexion;

import com.cryptachat.dto.push.PushFrame;
import com.cryptachat.servicios.entrega.PushGateway;
import com.cryptachat.servicios.metrics.ServerMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registro de usuarios en línea. Todas las altas, bajas y envíos pasan por una
 * única bandeja FIFO que procesa un solo hilo de control; el mapa de
 * conexiones solo se modifica desde ese hilo.
 */
public class ConnectionHub implements PushGateway, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionHub.class.getName());

    static final String DROP_OFFLINE = "offline";
    static final String DROP_QUEUE_FULL = "queue_full";
    static final String DROP_SERIALIZE_FAILED = "serialize_failed";
    static final String DROP_HUB_SATURATED = "hub_saturated";

    private final HubSettings settings;
    private final BlockingQueue<HubCommand> inbox = new LinkedBlockingQueue<>();
    private final Map<Long, PushConnection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger pendingPushes = new AtomicInteger();
    private final ObjectWriter frameWriter;
    private final ExecutorService pumpExecutor;
    private final Thread loopThread;
    private volatile boolean running;

    public ConnectionHub(HubSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.frameWriter = mapper.writerFor(PushFrame.class);
        AtomicInteger pumpSequence = new AtomicInteger();
        this.pumpExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "push-pump-" + pumpSequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.loopThread = new Thread(this::runLoop, "connection-hub");
        this.loopThread.setDaemon(true);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread.start();
        LOGGER.info(() -> "Hub de conexiones iniciado (cola por conexión " + settings.queueCapacity()
                + ", backlog " + settings.pushBacklog() + ")");
    }

    /**
     * Crea la conexión de un usuario ya autenticado, la registra y arranca sus
     * bombas. Una conexión previa del mismo usuario queda reemplazada.
     */
    public PushConnection connect(Long userId, FrameStream stream) {
        PushConnection connection = new PushConnection(userId, stream, settings, this);
        if (!running) {
            LOGGER.warning(() -> "Hub detenido; se rechaza la conexión del usuario " + userId);
            stream.close();
            ServerMetrics.onPushConnectionRejected("hub_stopped");
            return connection;
        }
        inbox.add(new Register(connection));
        connection.start(pumpExecutor);
        return connection;
    }

    void unregister(PushConnection connection) {
        if (running) {
            inbox.add(new Unregister(connection));
        }
    }

    @Override
    public void submit(Long userId, PushFrame frame) {
        if (userId == null || frame == null) {
            return;
        }
        if (!running) {
            LOGGER.fine(() -> "Hub detenido; se descarta push para " + userId);
            return;
        }
        if (pendingPushes.incrementAndGet() > settings.pushBacklog()) {
            pendingPushes.decrementAndGet();
            drop(DROP_HUB_SATURATED, userId);
            return;
        }
        inbox.add(new Push(userId, frame));
    }

    public boolean isOnline(Long userId) {
        return userId != null && connections.containsKey(userId);
    }

    public int onlineCount() {
        return connections.size();
    }

    /**
     * Espera a que el hilo de control procese todo lo encolado hasta ahora.
     */
    boolean awaitProcessed(Duration timeout) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        inbox.add(new Barrier(latch));
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    int pendingPushes() {
        return pendingPushes.get();
    }

    boolean pumpsShutdown() {
        return pumpExecutor.isShutdown();
    }

    private void runLoop() {
        while (running) {
            HubCommand command;
            try {
                command = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                dispatch(command);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Error procesando comando del hub " + command, e);
            }
        }
        shutdownConnections();
    }

    private void dispatch(HubCommand command) {
        if (command instanceof Push push) {
            handlePush(push);
        } else if (command instanceof Register register) {
            handleRegister(register.connection());
        } else if (command instanceof Unregister unregister) {
            handleUnregister(unregister.connection());
        } else if (command instanceof Barrier barrier) {
            barrier.latch().countDown();
        } else if (command instanceof Stop) {
            running = false;
        }
    }

    private void handleRegister(PushConnection connection) {
        PushConnection previous = connections.put(connection.userId(), connection);
        if (previous != null && previous != connection) {
            // el write pump de la anterior drena y cierra su flujo
            previous.queue().close();
            ServerMetrics.onPushConnectionSuperseded();
            ServerMetrics.onPushConnectionUnregistered();
            LOGGER.info(() -> "Conexión previa del usuario " + connection.userId() + " reemplazada");
        }
        ServerMetrics.onPushConnectionRegistered();
        LOGGER.info(() -> "Usuario " + connection.userId() + " conectado al canal push ("
                + connections.size() + " en línea)");
    }

    private void handleUnregister(PushConnection connection) {
        if (connections.remove(connection.userId(), connection)) {
            connection.queue().close();
            ServerMetrics.onPushConnectionUnregistered();
            LOGGER.info(() -> "Usuario " + connection.userId() + " desconectado del canal push");
        }
    }

    private void handlePush(Push push) {
        pendingPushes.decrementAndGet();
        PushConnection connection = connections.get(push.userId());
        if (connection == null) {
            drop(DROP_OFFLINE, push.userId());
            return;
        }
        String json;
        try {
            json = frameWriter.writeValueAsString(push.frame());
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "No se pudo serializar el frame para " + push.userId(), e);
            ServerMetrics.recordPushDropped(DROP_SERIALIZE_FAILED);
            return;
        }
        if (connection.queue().offer(json)) {
            ServerMetrics.recordPushEnqueued();
            return;
        }
        // cola saturada: el cliente no consume, se le desconecta
        drop(DROP_QUEUE_FULL, push.userId());
        handleUnregister(connection);
        connection.abort();
    }

    private void drop(String reason, Long userId) {
        ServerMetrics.recordPushDropped(reason);
        Level level = DROP_OFFLINE.equals(reason) ? Level.FINE : Level.WARNING;
        LOGGER.log(level, () -> "Push para usuario " + userId + " descartado: " + reason);
    }

    private void shutdownConnections() {
        connections.values().forEach(connection -> {
            connection.queue().close();
            connection.abort();
            ServerMetrics.onPushConnectionUnregistered();
        });
        connections.clear();
    }

    @Override
    public void close() {
        boolean detener;
        synchronized (this) {
            detener = running;
            if (detener) {
                inbox.add(new Stop());
            }
        }
        if (detener) {
            try {
                loopThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            LOGGER.info("Hub de conexiones detenido");
        }
        pumpExecutor.shutdownNow();
    }

    private interface HubCommand {
    }

    private record Register(PushConnection connection) implements HubCommand {
    }

    private record Unregister(PushConnection connection) implements HubCommand {
    }

    private record Push(Long userId, PushFrame frame) implements HubCommand {
    }

    private record Barrier(CountDownLatch latch) implements HubCommand {
    }

    private record Stop() implements HubCommand {
    }
}
