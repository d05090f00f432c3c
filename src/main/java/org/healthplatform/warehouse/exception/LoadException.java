package org.healthplatform.warehouse.exception;

/**
 * I/O or transaction failure during the bulk copy. The batch has been rolled back.
 */
public class LoadException extends TransformException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
