package com.cryptachat.repositorios.jdbc;

import com.cryptachat.entidades.EstadoSolicitud;
import com.cryptachat.entidades.SolicitudChat;
import com.cryptachat.repositorios.RegistroDuplicadoException;
import com.cryptachat.repositorios.SolicitudChatRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class JdbcSolicitudChatRepository extends JdbcSupport implements SolicitudChatRepository {

    public JdbcSolicitudChatRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public SolicitudChat save(SolicitudChat solicitud) {
        String sql = "INSERT INTO solicitudes_chat(solicitante_id, solicitado_id, estado) VALUES(?, ?, ?)";
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, solicitud.getSolicitanteId());
            ps.setLong(2, solicitud.getSolicitadoId());
            ps.setString(3, solicitud.getEstado().valor());
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    solicitud.setId(rs.getLong(1));
                }
            }
            return solicitud;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new RegistroDuplicadoException("Chat request already exists", e);
            }
            throw new IllegalStateException("Error inserting chat request", e);
        }
    }

    @Override
    public List<SolicitudChat> findPendientesPara(Long solicitadoId) {
        String sql = "SELECT sc.id, sc.solicitante_id, sc.solicitado_id, sc.estado, u.nombre_usuario AS solicitante_nombre " +
                "FROM solicitudes_chat sc JOIN usuarios u ON u.id = sc.solicitante_id " +
                "WHERE sc.solicitado_id=? AND sc.estado=? ORDER BY sc.id";
        return queryList(sql, this::map, solicitadoId, EstadoSolicitud.PENDING.valor());
    }

    @Override
    public boolean aceptar(Long solicitanteId, Long solicitadoId) {
        String sql = "UPDATE solicitudes_chat SET estado=? WHERE solicitante_id=? AND solicitado_id=? AND estado=?";
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, EstadoSolicitud.ACCEPTED.valor(), solicitanteId, solicitadoId, EstadoSolicitud.PENDING.valor());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Error accepting chat request", e);
        }
    }

    @Override
    public List<String> findContactos(Long usuarioId) {
        String solicitados = "SELECT u.nombre_usuario FROM solicitudes_chat sc " +
                "JOIN usuarios u ON u.id = sc.solicitado_id WHERE sc.solicitante_id=? AND sc.estado=? ORDER BY u.nombre_usuario";
        String solicitantes = "SELECT u.nombre_usuario FROM solicitudes_chat sc " +
                "JOIN usuarios u ON u.id = sc.solicitante_id WHERE sc.solicitado_id=? AND sc.estado=? ORDER BY u.nombre_usuario";
        String aceptada = EstadoSolicitud.ACCEPTED.valor();
        Set<String> contactos = new LinkedHashSet<>();
        contactos.addAll(queryList(solicitados, rs -> rs.getString(1), usuarioId, aceptada));
        contactos.addAll(queryList(solicitantes, rs -> rs.getString(1), usuarioId, aceptada));
        return new ArrayList<>(contactos);
    }

    private SolicitudChat map(ResultSet rs) throws SQLException {
        SolicitudChat solicitud = new SolicitudChat(
                rs.getLong("solicitante_id"),
                rs.getLong("solicitado_id"),
                EstadoSolicitud.desde(rs.getString("estado")));
        solicitud.setId(rs.getLong("id"));
        solicitud.setSolicitanteNombre(rs.getString("solicitante_nombre"));
        return solicitud;
    }
}
