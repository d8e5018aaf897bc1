package com.cryptachat.bootstrap;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.cryptachat.controladores.conexion.ConnectionHub;
import com.cryptachat.controladores.conexion.HubSettings;
import com.cryptachat.servicios.security.HmacTokenService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TcpPushServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HmacTokenService tokens = new HmacTokenService("secreto-tcp", Duration.ofHours(1));
    private final HubSettings settings = new HubSettings(16, 64, Duration.ofSeconds(5), Duration.ofSeconds(10), 512);
    private ConnectionHub hub;
    private TcpPushServer server;

    @BeforeEach
    void setUp() throws IOException {
        hub = new ConnectionHub(settings);
        hub.start();
        server = new TcpPushServer(0, 1, tokens, hub, settings);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.shutdown();
        hub.close();
    }

    @Test
    void autenticaPorElPuertoTcp() throws Exception {
        try (Socket socket = new Socket("localhost", server.getPort())) {
            socket.setSoTimeout(5000);
            send(socket, "{\"command\":\"AUTH\",\"payload\":{\"token\":\"" + tokens.issue(9L, "ivan") + "\"}}");

            JsonNode ok = read(socket);
            assertEquals("AUTH_OK", ok.get("command").asText());
            assertTrue(waitUntil(() -> hub.isOnline(9L)));
        }
        assertTrue(waitUntil(() -> !hub.isOnline(9L)));
        assertTrue(waitUntil(() -> server.activeSockets() == 0));
    }

    @Test
    void rechazaConexionesPorEncimaDelLimite() throws Exception {
        try (Socket primera = new Socket("localhost", server.getPort())) {
            assertTrue(waitUntil(() -> server.activeSockets() == 1));

            try (Socket segunda = new Socket("localhost", server.getPort())) {
                segunda.setSoTimeout(5000);
                JsonNode error = read(segunda);
                assertEquals("ERROR", error.get("command").asText());
                assertTrue(error.get("payload").get("message").asText().contains("Servidor lleno"));
            }
        }
        assertTrue(waitUntil(() -> server.activeSockets() == 0));
    }

    private void send(Socket socket, String line) throws IOException {
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    private JsonNode read(Socket socket) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        return mapper.readTree(reader.readLine());
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
