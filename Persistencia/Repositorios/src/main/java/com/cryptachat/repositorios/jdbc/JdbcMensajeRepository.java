package com.cryptachat.repositorios.jdbc;

import com.cryptachat.entidades.Mensaje;
import com.cryptachat.repositorios.MensajeRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Expected schema fragment:
 * <pre>
 * CREATE TABLE mensajes (
 *   id BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   emisor_id BIGINT NOT NULL,
 *   receptor_id BIGINT NOT NULL,
 *   blob_emisor TEXT NOT NULL,
 *   blob_receptor TEXT NOT NULL,
 *   enviado_en DATETIME(3) NOT NULL
 * );
 * </pre>
 */
public class JdbcMensajeRepository extends JdbcSupport implements MensajeRepository {

    public JdbcMensajeRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public Mensaje append(Mensaje mensaje) {
        if (mensaje.getTimeStamp() == null) {
            // DATETIME(3) guarda milisegundos; se trunca para que la instancia coincida con la fila
            mensaje.setTimeStamp(LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS));
        }
        String sql = "INSERT INTO mensajes(emisor_id, receptor_id, blob_emisor, blob_receptor, enviado_en) VALUES(?,?,?,?,?)";
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, mensaje.getEmisor());
            ps.setLong(2, mensaje.getReceptor());
            ps.setString(3, mensaje.getBlobEmisor());
            ps.setString(4, mensaje.getBlobReceptor());
            ps.setTimestamp(5, Timestamp.valueOf(mensaje.getTimeStamp()));
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    mensaje.setId(rs.getLong(1));
                }
            }
            return mensaje;
        } catch (SQLException e) {
            throw new IllegalStateException("Error inserting message", e);
        }
    }

    @Override
    public List<Mensaje> findConversation(Long usuarioA, Long usuarioB, long sinceId) {
        String sql = "SELECT m.id, m.emisor_id, m.receptor_id, m.blob_emisor, m.blob_receptor, m.enviado_en, " +
                "u.nombre_usuario AS emisor_nombre " +
                "FROM mensajes m JOIN usuarios u ON u.id = m.emisor_id " +
                "WHERE ((m.emisor_id=? AND m.receptor_id=?) OR (m.emisor_id=? AND m.receptor_id=?)) AND m.id > ? " +
                "ORDER BY m.enviado_en ASC, m.id ASC";
        return queryList(sql, this::map, usuarioA, usuarioB, usuarioB, usuarioA, sinceId);
    }

    private Mensaje map(ResultSet rs) throws SQLException {
        Mensaje mensaje = new Mensaje(
                rs.getLong("emisor_id"),
                rs.getLong("receptor_id"),
                rs.getString("blob_emisor"),
                rs.getString("blob_receptor"));
        mensaje.setId(rs.getLong("id"));
        Timestamp ts = rs.getTimestamp("enviado_en");
        mensaje.setTimeStamp(ts != null ? ts.toLocalDateTime() : null);
        mensaje.setEmisorNombre(rs.getString("emisor_nombre"));
        return mensaje;
    }
}
