package com.cryptachat.dto.push;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Tramas que el servidor empuja por el canal en tiempo real. Cada variante
 * lleva su discriminador en la propiedad {@code type}; hoy solo existe el
 * registro de mensaje.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageFrame.class, name = MessageFrame.TYPE)
})
public interface PushFrame {
}
