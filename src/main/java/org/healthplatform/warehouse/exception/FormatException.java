package org.healthplatform.warehouse.exception;

/**
 * The raw payload could not be parsed, or its structural columns could not be resolved.
 */
public class FormatException extends TransformException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
