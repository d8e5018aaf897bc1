package com.cryptachat.dto;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingRequestsResponse {

    private List<PendingRequestDto> pendingRequests;

    public PendingRequestsResponse() {
    }

    public PendingRequestsResponse(List<PendingRequestDto> pendingRequests) {
        this.pendingRequests = pendingRequests;
    }

    public List<PendingRequestDto> getPendingRequests() {
        return pendingRequests;
    }

    public void setPendingRequests(List<PendingRequestDto> pendingRequests) {
        this.pendingRequests = pendingRequests;
    }
}
