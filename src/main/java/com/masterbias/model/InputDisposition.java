package com.masterbias.model;

// Que hacer con los archivos de entrada despues de combinar
public enum InputDisposition {
    NOTHING,
    SUBFOLDER
}
