package com.ciro.remi.error;

/**
 * Base de todas las excepciones del checker. No chequeada, igual que los
 * {@code RuntimeException} que envuelven fallos en el resto del framework.
 */
public class RemiException extends RuntimeException {

    public RemiException(String message) {
        super(message);
    }

    public RemiException(String message, Throwable cause) {
        super(message, cause);
    }
}
