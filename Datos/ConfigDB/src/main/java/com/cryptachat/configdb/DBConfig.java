package com.cryptachat.configdb;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.sql.DataSource;

import com.mysql.cj.jdbc.MysqlConnectionPoolDataSource;

/**
 * Centralised configuration helper that reads the <code>properties/database.properties</code> file
 * from the classpath and exposes the MySQL {@link DataSource} used by the repositories.
 * Every key may be overridden by an environment variable named after it in upper case with dots
 * replaced by underscores (<code>mysql.url</code> becomes <code>MYSQL_URL</code>).
 */
public final class DBConfig {

    private static final Logger LOGGER = Logger.getLogger(DBConfig.class.getName());
    private static final String DATABASE_CONFIG_PATH = "/properties/database.properties";

    private static volatile DBConfig instance;

    private final Properties properties = new Properties();
    private volatile DataSource dataSource;

    private DBConfig() {
        loadProperties();
    }

    public static DBConfig getInstance() {
        DBConfig local = instance;
        if (local == null) {
            synchronized (DBConfig.class) {
                local = instance;
                if (local == null) {
                    local = new DBConfig();
                    instance = local;
                }
            }
        }
        return local;
    }

    private void loadProperties() {
        try (InputStream in = DBConfig.class.getResourceAsStream(DATABASE_CONFIG_PATH)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file not found at " + DATABASE_CONFIG_PATH);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load database configuration properties", e);
        }
    }

    private DataSource buildMySqlDataSource() {
        MysqlConnectionPoolDataSource ds = new MysqlConnectionPoolDataSource();
        ds.setURL(require("mysql.url"));
        ds.setUser(require("mysql.user"));
        ds.setPassword(getProperty("mysql.password", ""));
        Optional.ofNullable(getProperty("mysql.driver"))
                .ifPresent(driver -> {
                    try {
                        Class.forName(driver);
                    } catch (ClassNotFoundException e) {
                        LOGGER.log(Level.WARNING, "JDBC driver not found: {0}", driver);
                    }
                });
        return ds;
    }

    public String require(String key) {
        return Optional.ofNullable(getProperty(key))
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new IllegalStateException("Missing property: " + key));
    }

    public DataSource getMySqlDataSource() {
        DataSource local = dataSource;
        if (local == null) {
            synchronized (this) {
                local = dataSource;
                if (local == null) {
                    local = buildMySqlDataSource();
                    dataSource = local;
                }
            }
        }
        return local;
    }

    public String getProperty(String key) {
        String fromEnv = System.getenv(toEnvName(key));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    private static String toEnvName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }
}
