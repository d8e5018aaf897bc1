package com.cryptachat.controladores.conexion;

import com.cryptachat.dto.push.MessageFrame;
import com.cryptachat.servicios.security.HmacTokenService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionHandlerIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HmacTokenService tokenService = new HmacTokenService("secreto-de-prueba", Duration.ofHours(1));
    private final HubSettings settings = new HubSettings(16, 64, Duration.ofSeconds(5), Duration.ofSeconds(10), 512);
    private ConnectionHub hub;

    @BeforeEach
    void setUp() {
        hub = new ConnectionHub(settings);
        hub.start();
    }

    @AfterEach
    void tearDown() {
        hub.close();
    }

    @Test
    void autenticaYRecibeMensajesPorElSocket() throws Exception {
        try (ClientHandle client = connect()) {
            client.send("{\"command\":\"AUTH\",\"payload\":{\"token\":\"" + tokenService.issue(2L, "bob") + "\"}}");

            JsonNode ok = client.read();
            assertEquals("AUTH_OK", ok.get("command").asText());
            assertEquals(2L, ok.get("payload").get("user_id").asLong());
            assertEquals("bob", ok.get("payload").get("username").asText());

            assertTrue(waitUntil(() -> hub.isOnline(2L)));
            hub.submit(2L, new MessageFrame(11L, 1L, 2L, LocalDateTime.of(2024, 1, 1, 8, 0, 1), "alice", "cifrado"));

            JsonNode frame = client.read();
            assertEquals("message", frame.get("type").asText());
            assertEquals(11L, frame.get("id").asLong());
            assertEquals("cifrado", frame.get("encrypted_blob").asText());
        }
    }

    @Test
    void tokenInvalidoRecibeErrorYCierre() throws Exception {
        try (ClientHandle client = connect()) {
            client.send("{\"command\":\"AUTH\",\"payload\":{\"token\":\"no-es-un-token\"}}");

            JsonNode error = client.read();
            assertEquals("ERROR", error.get("command").asText());
            assertNotNull(error.get("payload").get("message"));
            assertNull(client.reader.readLine(), "el servidor debe cerrar el socket");
            assertFalse(hub.isOnline(2L));
        }
    }

    @Test
    void comandoDistintoDeAuthSeRechaza() throws Exception {
        try (ClientHandle client = connect()) {
            client.send("{\"command\":\"SEND\",\"payload\":{}}");

            assertEquals("ERROR", client.read().get("command").asText());
        }
    }

    @Test
    void jsonInvalidoSeRechaza() throws Exception {
        try (ClientHandle client = connect()) {
            client.send("esto no es json");

            JsonNode error = client.read();
            assertEquals("ERROR", error.get("command").asText());
            assertEquals("Formato JSON inválido", error.get("payload").get("message").asText());
        }
    }

    @Test
    void cierreDelClienteDaDeBajaLaConexion() throws Exception {
        ClientHandle client = connect();
        client.send("{\"command\":\"AUTH\",\"payload\":{\"token\":\"" + tokenService.issue(3L, "carol") + "\"}}");
        assertEquals("AUTH_OK", client.read().get("command").asText());
        assertTrue(waitUntil(() -> hub.isOnline(3L)));

        client.close();

        assertTrue(waitUntil(() -> !hub.isOnline(3L)));
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                return false;
            }
            Thread.sleep(20);
        }
        return true;
    }

    private ClientHandle connect() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
                try {
                    return server.accept();
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            });
            Socket client = new Socket("127.0.0.1", server.getLocalPort());
            client.setSoTimeout(2000);
            Socket serverSide = accepted.get(2, TimeUnit.SECONDS);
            Thread handler = new Thread(new ConnectionHandler(serverSide, tokenService, hub, settings, () -> { }));
            handler.setDaemon(true);
            handler.start();
            return new ClientHandle(client);
        }
    }

    private final class ClientHandle implements AutoCloseable {
        private final Socket socket;
        private final BufferedReader reader;
        private final BufferedWriter writer;

        private ClientHandle(Socket socket) throws IOException {
            this.socket = socket;
            this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        }

        void send(String line) throws IOException {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }

        JsonNode read() throws IOException {
            String line = reader.readLine();
            assertNotNull(line, "se esperaba una línea del servidor");
            return mapper.readTree(line);
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
