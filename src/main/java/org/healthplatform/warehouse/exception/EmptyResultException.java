package org.healthplatform.warehouse.exception;

public class EmptyResultException extends TransformException {

    public EmptyResultException(String message) {
        super(message);
    }
}
