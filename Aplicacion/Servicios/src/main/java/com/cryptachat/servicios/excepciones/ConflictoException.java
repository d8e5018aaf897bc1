package com.cryptachat.servicios.excepciones;

public class ConflictoException extends RuntimeException {

    public ConflictoException(String message) {
        super(message);
    }
}
