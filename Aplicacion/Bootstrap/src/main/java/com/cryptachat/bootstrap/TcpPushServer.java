package com.cryptachat.bootstrap;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cryptachat.controladores.conexion.ConnectionHandler;
import com.cryptachat.controladores.conexion.ConnectionHub;
import com.cryptachat.controladores.conexion.HubSettings;
import com.cryptachat.dto.ApiMessage;
import com.cryptachat.dto.CommandEnvelope;
import com.cryptachat.servicios.metrics.ServerMetrics;
import com.cryptachat.servicios.security.TokenService;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Servidor TCP del canal push: acepta sockets y delega el saludo AUTH en un
 * {@link ConnectionHandler}. Tras autenticarse, el socket pertenece al hub.
 */
public class TcpPushServer implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(TcpPushServer.class.getName());

    private final int port;
    private final int maxConnections;
    private final TokenService tokenService;
    private final ConnectionHub hub;
    private final HubSettings settings;
    private final AtomicInteger activeSockets = new AtomicInteger();
    private final ExecutorService executor;
    private final ObjectMapper mapper = new ObjectMapper();

    private volatile ServerSocket serverSocket;
    private volatile boolean running = false;

    public TcpPushServer(int port,
                         int maxConnections,
                         TokenService tokenService,
                         ConnectionHub hub,
                         HubSettings settings) {
        this.port = port;
        this.maxConnections = maxConnections;
        this.tokenService = tokenService;
        this.hub = hub;
        this.settings = settings;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "push-handshake");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Abre el puerto de forma síncrona y lanza el bucle de aceptación en un
     * hilo propio.
     */
    public void start() throws IOException {
        serverSocket = new ServerSocket(port);
        running = true;
        LOGGER.log(Level.INFO, "Servidor push TCP iniciado en {0}:{1}",
            new Object[]{getServerAddress(), String.valueOf(getPort())});
        Thread serverThread = new Thread(this, "TCP-Push-Server");
        serverThread.setDaemon(true);
        serverThread.start();
    }

    @Override
    public void run() {
        try {
            while (running) {
                try {
                    Socket clientSocket = serverSocket.accept();
                    accept(clientSocket);
                } catch (IOException e) {
                    if (running) {
                        LOGGER.log(Level.WARNING, "Error aceptando conexión", e);
                    }
                }
            }
        } finally {
            shutdown();
        }
    }

    private void accept(Socket clientSocket) throws IOException {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());
        int current = activeSockets.incrementAndGet();
        if (current > maxConnections) {
            activeSockets.decrementAndGet();
            LOGGER.log(Level.WARNING,
                "Conexión rechazada desde {0} - Límite alcanzado ({1}/{2} conexiones)",
                new Object[]{clientAddress, current - 1, maxConnections});
            ServerMetrics.onPushConnectionRejected("server_full");
            rejectFull(clientSocket);
            return;
        }
        LOGGER.log(Level.FINE, "Nueva conexión push desde {0} ({1}/{2} conexiones)",
            new Object[]{clientAddress, current, maxConnections});
        executor.execute(new ConnectionHandler(clientSocket, tokenService, hub, settings,
            activeSockets::decrementAndGet));
    }

    private void rejectFull(Socket clientSocket) throws IOException {
        try (clientSocket) {
            BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(clientSocket.getOutputStream(), StandardCharsets.UTF_8));
            writer.write(mapper.writeValueAsString(new CommandEnvelope(CommandEnvelope.ERROR,
                new ApiMessage("Servidor lleno. Máximo de conexiones alcanzado."))));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "No se pudo notificar el rechazo", e);
        }
    }

    private String getServerAddress() {
        try {
            return InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            LOGGER.log(Level.WARNING, "No se pudo obtener la dirección IP local", e);
            return "localhost";
        }
    }

    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        ServerSocket current = serverSocket;
        if (current != null && !current.isClosed()) {
            try {
                current.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Error cerrando ServerSocket", e);
            }
        }
        executor.shutdown();
        LOGGER.log(Level.INFO, "Servidor push TCP detenido");
    }

    public int activeSockets() {
        return activeSockets.get();
    }

    /**
     * Puerto efectivo; útil cuando se configuró 0.
     */
    public int getPort() {
        ServerSocket current = serverSocket;
        return current != null ? current.getLocalPort() : port;
    }
}
