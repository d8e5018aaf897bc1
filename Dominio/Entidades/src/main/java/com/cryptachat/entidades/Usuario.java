package com.cryptachat.entidades;

public class Usuario {
    private Long id;
    private String nombreDeUsuario;
    private String contrasenia;

    public Usuario() {
    }

    public Usuario(Long id, String nombreDeUsuario, String contrasenia) {
        this.id = id;
        this.nombreDeUsuario = nombreDeUsuario;
        this.contrasenia = contrasenia;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getNombreDeUsuario() {
        return nombreDeUsuario;
    }

    public void setNombreDeUsuario(String nombreDeUsuario) {
        this.nombreDeUsuario = nombreDeUsuario;
    }

    /**
     * Hash de la contraseña en el formato producido por el hasher configurado;
     * nunca la contraseña en claro.
     */
    public String getContrasenia() {
        return contrasenia;
    }

    public void setContrasenia(String contrasenia) {
        this.contrasenia = contrasenia;
    }
}
