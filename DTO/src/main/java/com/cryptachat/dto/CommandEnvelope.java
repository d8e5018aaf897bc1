package com.cryptachat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Sobre de comandos del canal TCP de notificaciones: una línea JSON por
 * comando, por ejemplo {@code {"command":"AUTH","payload":{"token":"..."}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandEnvelope {

    public static final String AUTH = "AUTH";
    public static final String AUTH_OK = "AUTH_OK";
    public static final String ERROR = "ERROR";

    private String command;
    private Object payload;

    public CommandEnvelope() {
    }

    public CommandEnvelope(String command, Object payload) {
        this.command = command;
        this.payload = payload;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public Object getPayload() {
        return payload;
    }

    public void setPayload(Object payload) {
        this.payload = payload;
    }
}
