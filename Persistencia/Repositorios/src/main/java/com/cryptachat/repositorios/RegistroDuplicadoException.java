package com.cryptachat.repositorios;

/**
 * Se lanza cuando una inserción viola una restricción de unicidad.
 */
public class RegistroDuplicadoException extends IllegalStateException {

    public RegistroDuplicadoException(String message, Throwable cause) {
        super(message, cause);
    }
}
