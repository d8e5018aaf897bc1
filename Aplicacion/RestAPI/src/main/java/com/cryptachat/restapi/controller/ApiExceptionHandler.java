package com.cryptachat.restapi.controller;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.cryptachat.dto.ApiMessage;
import com.cryptachat.servicios.excepciones.ConflictoException;
import com.cryptachat.servicios.excepciones.CredencialesInvalidasException;
import com.cryptachat.servicios.excepciones.RecursoNoEncontradoException;
import com.cryptachat.servicios.security.TokenInvalidoException;

/**
 * Traduce las excepciones de los servicios a respuestas {@code {"message": ...}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = Logger.getLogger(ApiExceptionHandler.class.getName());

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiMessage> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiMessage> invalidBody(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid JSON body");
    }

    @ExceptionHandler(RecursoNoEncontradoException.class)
    public ResponseEntity<ApiMessage> notFound(RecursoNoEncontradoException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ConflictoException.class)
    public ResponseEntity<ApiMessage> conflict(ConflictoException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({CredencialesInvalidasException.class, TokenInvalidoException.class})
    public ResponseEntity<ApiMessage> unauthorized(RuntimeException e) {
        return respond(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiMessage> internalError(RuntimeException e) {
        LOGGER.log(Level.SEVERE, "Error no controlado en la API", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ApiMessage> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ApiMessage(message));
    }
}
