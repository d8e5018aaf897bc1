package com.cryptachat.entidades;

import java.util.Locale;

public enum EstadoSolicitud {
    PENDING,
    ACCEPTED,
    BLOCKED;

    public String valor() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EstadoSolicitud desde(String valor) {
        if (valor == null || valor.isBlank()) {
            throw new IllegalArgumentException("Estado de solicitud vacío");
        }
        return valueOf(valor.trim().toUpperCase(Locale.ROOT));
    }
}
