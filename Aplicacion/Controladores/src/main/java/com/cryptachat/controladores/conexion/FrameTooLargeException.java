package com.cryptachat.controladores.conexion;

import java.io.IOException;

public class FrameTooLargeException extends IOException {

    public FrameTooLargeException(int maxBytes) {
        super("Frame entrante excede " + maxBytes + " bytes");
    }
}
