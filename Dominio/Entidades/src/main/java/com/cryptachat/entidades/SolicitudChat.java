package com.cryptachat.entidades;

/**
 * Solicitud de contacto entre dos usuarios. El par (solicitante, solicitado)
 * es único: una segunda solicitud con el mismo par se rechaza aunque la
 * primera ya esté aceptada.
 */
public class SolicitudChat {
    private Long id;
    private Long solicitanteId;
    private Long solicitadoId;
    private EstadoSolicitud estado;
    private String solicitanteNombre;

    public SolicitudChat() {
    }

    public SolicitudChat(Long solicitanteId, Long solicitadoId, EstadoSolicitud estado) {
        this.solicitanteId = solicitanteId;
        this.solicitadoId = solicitadoId;
        this.estado = estado;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getSolicitanteId() {
        return solicitanteId;
    }

    public void setSolicitanteId(Long solicitanteId) {
        this.solicitanteId = solicitanteId;
    }

    public Long getSolicitadoId() {
        return solicitadoId;
    }

    public void setSolicitadoId(Long solicitadoId) {
        this.solicitadoId = solicitadoId;
    }

    public EstadoSolicitud getEstado() {
        return estado;
    }

    public void setEstado(EstadoSolicitud estado) {
        this.estado = estado;
    }

    public String getSolicitanteNombre() {
        return solicitanteNombre;
    }

    public void setSolicitanteNombre(String solicitanteNombre) {
        this.solicitanteNombre = solicitanteNombre;
    }
}
