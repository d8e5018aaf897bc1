package com.cryptachat.repositorios.jdbc;

import com.cryptachat.entidades.Usuario;
import com.cryptachat.repositorios.RegistroDuplicadoException;
import com.cryptachat.repositorios.UsuarioRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

public class JdbcUsuarioRepository extends JdbcSupport implements UsuarioRepository {

    public JdbcUsuarioRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public Usuario save(Usuario usuario) {
        String sql = "INSERT INTO usuarios(nombre_usuario, contrasenia) VALUES(?, ?)";
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, usuario.getNombreDeUsuario());
            ps.setString(2, usuario.getContrasenia());
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    usuario.setId(rs.getLong(1));
                }
            }
            return usuario;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new RegistroDuplicadoException("Username already exists: " + usuario.getNombreDeUsuario(), e);
            }
            throw new IllegalStateException("Error inserting user", e);
        }
    }

    @Override
    public Optional<Usuario> findById(Long id) {
        return first(queryList("SELECT id, nombre_usuario, contrasenia FROM usuarios WHERE id=?", this::map, id));
    }

    @Override
    public Optional<Usuario> findByNombreDeUsuario(String nombreDeUsuario) {
        return first(queryList("SELECT id, nombre_usuario, contrasenia FROM usuarios WHERE nombre_usuario=?",
                this::map, nombreDeUsuario));
    }

    private Optional<Usuario> first(List<Usuario> usuarios) {
        return usuarios.isEmpty() ? Optional.empty() : Optional.of(usuarios.get(0));
    }

    private Usuario map(ResultSet rs) throws SQLException {
        return new Usuario(rs.getLong("id"), rs.getString("nombre_usuario"), rs.getString("contrasenia"));
    }
}
