package com.cryptachat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SendMessageRequest {

    private String recipientUsername;
    private String senderBlob;
    private String recipientBlob;

    public SendMessageRequest() {
    }

    public SendMessageRequest(String recipientUsername, String senderBlob, String recipientBlob) {
        this.recipientUsername = recipientUsername;
        this.senderBlob = senderBlob;
        this.recipientBlob = recipientBlob;
    }

    public String getRecipientUsername() {
        return recipientUsername;
    }

    public void setRecipientUsername(String recipientUsername) {
        this.recipientUsername = recipientUsername;
    }

    public String getSenderBlob() {
        return senderBlob;
    }

    public void setSenderBlob(String senderBlob) {
        this.senderBlob = senderBlob;
    }

    public String getRecipientBlob() {
        return recipientBlob;
    }

    public void setRecipientBlob(String recipientBlob) {
        this.recipientBlob = recipientBlob;
    }
}
