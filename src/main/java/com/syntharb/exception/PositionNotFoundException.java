package com.syntharb.exception;

public class PositionNotFoundException extends ResourceNotFoundException {

    private final String positionId;

    public PositionNotFoundException(String positionId) {
        super("Position", positionId);
        this.positionId = positionId;
    }

    public String getPositionId() {
        return positionId;
    }
}
