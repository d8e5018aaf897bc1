package com.cryptachat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingRequestDto {

    private String requesterUsername;
    private String status;

    public PendingRequestDto() {
    }

    public PendingRequestDto(String requesterUsername, String status) {
        this.requesterUsername = requesterUsername;
        this.status = status;
    }

    public String getRequesterUsername() {
        return requesterUsername;
    }

    public void setRequesterUsername(String requesterUsername) {
        this.requesterUsername = requesterUsername;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
