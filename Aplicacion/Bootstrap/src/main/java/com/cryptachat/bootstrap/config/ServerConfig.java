package com.cryptachat.bootstrap.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cryptachat.controladores.conexion.HubSettings;

/**
 * Centralised configuration helper that reads the <code>properties/server.properties</code> file
 * from the classpath and exposes typed accessors for the push channel, security, metrics and
 * logging configuration.
 */
public final class ServerConfig {

    private static final Logger LOGGER = Logger.getLogger(ServerConfig.class.getName());
    private static final String CONFIG_PATH = "/properties/server.properties";
    private static final String SECRET_ENV = "SECRET_KEY";

    private static volatile ServerConfig instance;

    private final Properties properties;

    ServerConfig(Properties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public static ServerConfig getInstance() {
        ServerConfig local = instance;
        if (local == null) {
            synchronized (ServerConfig.class) {
                local = instance;
                if (local == null) {
                    local = new ServerConfig(loadProperties());
                    instance = local;
                }
            }
        }
        return local;
    }

    private static Properties loadProperties() {
        Properties loaded = new Properties();
        try (InputStream in = ServerConfig.class.getResourceAsStream(CONFIG_PATH)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file not found at " + CONFIG_PATH);
            }
            loaded.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load server configuration properties", e);
        }
        return loaded;
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getIntProperty(String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.log(Level.WARNING, "Invalid integer for {0}: {1}", new Object[]{key, raw});
            return defaultValue;
        }
    }

    public int getPushTcpPort() {
        return getIntProperty("push.tcpPort", 5050);
    }

    public int getMaxConnections() {
        return getIntProperty("push.maxConnections", 1000);
    }

    public int getMetricsPort() {
        return getIntProperty("metrics.port", 5150);
    }

    public HubSettings getHubSettings() {
        return new HubSettings(
            getIntProperty("push.queueCapacity", HubSettings.DEFAULT_QUEUE_CAPACITY),
            getIntProperty("push.pushBacklog", HubSettings.DEFAULT_PUSH_BACKLOG),
            Duration.ofSeconds(getIntProperty("push.pingIntervalSeconds",
                (int) HubSettings.DEFAULT_PING_INTERVAL.toSeconds())),
            Duration.ofSeconds(getIntProperty("push.idleTimeoutSeconds",
                (int) HubSettings.DEFAULT_IDLE_TIMEOUT.toSeconds())),
            getIntProperty("push.maxInboundFrameBytes", HubSettings.DEFAULT_MAX_INBOUND_FRAME_BYTES)
        );
    }

    public String getSecuritySalt() {
        return getProperty("security.salt", "cryptachat");
    }

    /**
     * La variable de entorno {@code SECRET_KEY} tiene prioridad sobre el fichero.
     */
    public String getTokenSecret() {
        String fromEnv = System.getenv(SECRET_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        String secret = getProperty("security.tokenSecret");
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Missing property: security.tokenSecret (or env " + SECRET_ENV + ")");
        }
        return secret;
    }

    public Duration getTokenTtl() {
        return Duration.ofHours(getIntProperty("security.tokenTtlHours", 24));
    }

    public Level getLogLevel() {
        String level = properties.getProperty("log.level");
        if (Objects.isNull(level)) {
            return Level.INFO;
        }
        try {
            return Level.parse(level.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Invalid log level {0}, defaulting to INFO", level);
            return Level.INFO;
        }
    }
}
