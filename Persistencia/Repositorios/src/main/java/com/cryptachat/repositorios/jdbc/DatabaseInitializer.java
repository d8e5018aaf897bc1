package com.cryptachat.repositorios.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Utility class that makes sure the schema required by the repositories
 * exists before the server starts accepting requests. The statements are
 * idempotent so they can be executed on every boot without affecting
 * existing data.
 */
public final class DatabaseInitializer {

    private DatabaseInitializer() {
    }

    public static void ensureSchema(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : schemaStatements()) {
                statement.executeUpdate(ddl);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Unable to initialise database schema", e);
        }
    }

    private static List<String> schemaStatements() {
        return List.of(
                "CREATE TABLE IF NOT EXISTS usuarios (" +
                        "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
                        "nombre_usuario VARCHAR(120) NOT NULL," +
                        "contrasenia VARCHAR(200) NOT NULL," +
                        "CONSTRAINT uk_usuarios_nombre UNIQUE (nombre_usuario)" +
                        ")",
                "CREATE TABLE IF NOT EXISTS claves_publicas (" +
                        "usuario_id BIGINT PRIMARY KEY," +
                        "clave_publica TEXT NOT NULL," +
                        "CONSTRAINT fk_claves_usuario FOREIGN KEY (usuario_id) REFERENCES usuarios (id)" +
                        ")",
                "CREATE TABLE IF NOT EXISTS solicitudes_chat (" +
                        "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
                        "solicitante_id BIGINT NOT NULL," +
                        "solicitado_id BIGINT NOT NULL," +
                        "estado VARCHAR(16) NOT NULL," +
                        "CONSTRAINT uk_solicitudes_par UNIQUE (solicitante_id, solicitado_id)," +
                        "CONSTRAINT fk_solicitudes_solicitante FOREIGN KEY (solicitante_id) REFERENCES usuarios (id)," +
                        "CONSTRAINT fk_solicitudes_solicitado FOREIGN KEY (solicitado_id) REFERENCES usuarios (id)" +
                        ")",
                "CREATE TABLE IF NOT EXISTS mensajes (" +
                        "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
                        "emisor_id BIGINT NOT NULL," +
                        "receptor_id BIGINT NOT NULL," +
                        "blob_emisor TEXT NOT NULL," +
                        "blob_receptor TEXT NOT NULL," +
                        "enviado_en DATETIME(3) NOT NULL," +
                        "CONSTRAINT fk_mensajes_emisor FOREIGN KEY (emisor_id) REFERENCES usuarios (id)," +
                        "CONSTRAINT fk_mensajes_receptor FOREIGN KEY (receptor_id) REFERENCES usuarios (id)" +
                        ")"
        );
    }
}
