package com.masterbias.service;

// Dimensiones o binning distintos dentro de la seleccion
public class IncompatibleSizesException extends MasterMakerException {

    public IncompatibleSizesException(String message) {
        super(message);
    }
}
