package com.masterbias.service;

import com.masterbias.model.FrameType;

public class WrongFrameTypeException extends MasterMakerException {
    private final FrameType requiredType;

    public WrongFrameTypeException(FrameType requiredType) {
        super("Selected files are not all " + requiredType.fitsLabel() + " frames");
        this.requiredType = requiredType;
    }

    public FrameType getRequiredType() {
        return requiredType;
    }
}
