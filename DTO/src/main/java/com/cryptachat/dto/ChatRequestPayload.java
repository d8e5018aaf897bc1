package com.cryptachat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Cuerpo de las rutas de solicitudes de chat. {@code request_chat} usa el
 * destinatario y {@code accept_chat} el solicitante.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatRequestPayload {

    private String recipientUsername;
    private String requesterUsername;

    public ChatRequestPayload() {
    }

    public ChatRequestPayload(String recipientUsername, String requesterUsername) {
        this.recipientUsername = recipientUsername;
        this.requesterUsername = requesterUsername;
    }

    public String getRecipientUsername() {
        return recipientUsername;
    }

    public void setRecipientUsername(String recipientUsername) {
        this.recipientUsername = recipientUsername;
    }

    public String getRequesterUsername() {
        return requesterUsername;
    }

    public void setRequesterUsername(String requesterUsername) {
        this.requesterUsername = requesterUsername;
    }
}
