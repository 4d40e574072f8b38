package com.masterbias.service;

public class EmptyInputException extends MasterMakerException {

    public EmptyInputException(String message) {
        super(message);
    }
}
