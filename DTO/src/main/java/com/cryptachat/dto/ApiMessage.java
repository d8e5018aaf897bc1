package com.cryptachat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Respuesta mínima de la API: un texto para el cliente, usado tanto en
 * confirmaciones como en errores.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApiMessage {

    private String message;

    public ApiMessage() {
    }

    public ApiMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
