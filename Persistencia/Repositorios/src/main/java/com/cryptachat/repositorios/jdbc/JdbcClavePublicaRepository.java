package com.cryptachat.repositorios.jdbc;

import com.cryptachat.repositorios.ClavePublicaRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Expected schema fragment:
 * <pre>
 * CREATE TABLE claves_publicas (
 *   usuario_id BIGINT PRIMARY KEY,
 *   clave_publica TEXT NOT NULL
 * );
 * </pre>
 */
public class JdbcClavePublicaRepository extends JdbcSupport implements ClavePublicaRepository {

    public JdbcClavePublicaRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public void upsert(Long usuarioId, String clavePublica) {
        Connection conn = null;
        try {
            conn = getConnection();
            conn.setAutoCommit(false);
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE claves_publicas SET clave_publica=? WHERE usuario_id=?")) {
                ps.setString(1, clavePublica);
                ps.setLong(2, usuarioId);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO claves_publicas(usuario_id, clave_publica) VALUES(?, ?)")) {
                    ps.setLong(1, usuarioId);
                    ps.setString(2, clavePublica);
                    ps.executeUpdate();
                }
            }
            conn.commit();
        } catch (SQLException e) {
            rollbackQuietly(conn);
            throw new IllegalStateException("Error storing public key", e);
        } finally {
            if (conn != null) {
                try {
                    conn.close();
                } catch (SQLException e) {
                    logger.fine(() -> "Error cerrando conexión: " + e.getMessage());
                }
            }
        }
    }

    @Override
    public Optional<String> findByNombreDeUsuario(String nombreDeUsuario) {
        String sql = "SELECT cp.clave_publica FROM claves_publicas cp " +
                "JOIN usuarios u ON u.id = cp.usuario_id WHERE u.nombre_usuario=?";
        List<String> claves = queryList(sql, rs -> rs.getString("clave_publica"), nombreDeUsuario);
        return claves.isEmpty() ? Optional.empty() : Optional.of(claves.get(0));
    }
}
