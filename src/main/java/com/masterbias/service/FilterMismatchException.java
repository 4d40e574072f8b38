package com.masterbias.service;

public class FilterMismatchException extends MasterMakerException {

    public FilterMismatchException() {
        super("Selected files do not all use the same filter");
    }
}
