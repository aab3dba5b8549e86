package io.iaf.operator.controller;

public class InvalidImageSourceException extends ReconcileException {

    public InvalidImageSourceException(String message) {
        super(message);
    }
}
