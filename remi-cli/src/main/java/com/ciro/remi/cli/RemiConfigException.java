package com.ciro.remi.cli;

import com.ciro.remi.error.RemiException;

public class RemiConfigException extends RemiException {

    public RemiConfigException(String message) {
        super(message);
    }

    public RemiConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
