package com.cryptachat.entidades;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Mensaje cifrado tal como se guarda en el log de mensajes. El servidor no
 * interpreta los blobs: cada lado recibe el suyo, cifrado con su propia clave
 * pública.
 */
public class Mensaje {
    private Long id;
    private LocalDateTime timeStamp;
    private Long emisor;
    private Long receptor;
    private String blobEmisor;
    private String blobReceptor;
    private String emisorNombre;

    public Mensaje() {
    }

    public Mensaje(Long emisor, Long receptor, String blobEmisor, String blobReceptor) {
        this.emisor = emisor;
        this.receptor = receptor;
        this.blobEmisor = blobEmisor;
        this.blobReceptor = blobReceptor;
    }

    /**
     * Devuelve el blob que corresponde al usuario que lee el mensaje: el del
     * emisor si lo envió él, el del receptor en cualquier otro caso.
     */
    public String blobPara(Long lectorId) {
        return Objects.equals(lectorId, emisor) ? blobEmisor : blobReceptor;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public LocalDateTime getTimeStamp() {
        return timeStamp;
    }

    public void setTimeStamp(LocalDateTime timeStamp) {
        this.timeStamp = timeStamp;
    }

    public Long getEmisor() {
        return emisor;
    }

    public void setEmisor(Long emisor) {
        this.emisor = emisor;
    }

    public Long getReceptor() {
        return receptor;
    }

    public void setReceptor(Long receptor) {
        this.receptor = receptor;
    }

    public String getBlobEmisor() {
        return blobEmisor;
    }

    public void setBlobEmisor(String blobEmisor) {
        this.blobEmisor = blobEmisor;
    }

    public String getBlobReceptor() {
        return blobReceptor;
    }

    public void setBlobReceptor(String blobReceptor) {
        this.blobReceptor = blobReceptor;
    }

    public String getEmisorNombre() {
        return emisorNombre;
    }

    public void setEmisorNombre(String emisorNombre) {
        this.emisorNombre = emisorNombre;
    }
}
