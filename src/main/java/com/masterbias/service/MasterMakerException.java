package com.masterbias.service;

/**
 * Base of the typed failures raised by the combining engine. Each subtype is reported to the
 * user with its own message; I/O problems are not wrapped and travel as {@link java.io.IOException}.
 */
public abstract class MasterMakerException extends Exception {

    protected MasterMakerException(String message) {
        super(message);
    }
}
