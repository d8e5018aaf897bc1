package com.cryptachat.dto;

import java.time.LocalDateTime;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Registro de mensaje visto por un usuario concreto: {@code encryptedBlob} es
 * el blob cifrado para quien lo lee, no para la otra parte.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageDto {

    private Long id;
    private Long senderId;
    private Long recipientId;
    private LocalDateTime timestamp;
    private String senderUsername;
    private String encryptedBlob;

    public MessageDto() {
    }

    public MessageDto(Long id, Long senderId, Long recipientId, LocalDateTime timestamp,
                      String senderUsername, String encryptedBlob) {
        this.id = id;
        this.senderId = senderId;
        this.recipientId = recipientId;
        this.timestamp = timestamp;
        this.senderUsername = senderUsername;
        this.encryptedBlob = encryptedBlob;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getSenderId() {
        return senderId;
    }

    public void setSenderId(Long senderId) {
        this.senderId = senderId;
    }

    public Long getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(Long recipientId) {
        this.recipientId = recipientId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public String getSenderUsername() {
        return senderUsername;
    }

    public void setSenderUsername(String senderUsername) {
        this.senderUsername = senderUsername;
    }

    public String getEncryptedBlob() {
        return encryptedBlob;
    }

    public void setEncryptedBlob(String encryptedBlob) {
        this.encryptedBlob = encryptedBlob;
    }
}
