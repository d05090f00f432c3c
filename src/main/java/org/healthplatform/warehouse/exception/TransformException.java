package org.healthplatform.warehouse.exception;

/**
 * Root of the typed errors a transformation run can fail with.
 * All of them are terminal for the run.
 */
public abstract class TransformException extends RuntimeException {

    protected TransformException(String message) {
        super(message);
    }

    protected TransformException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short structured description used in run reports, e.g. {@code DuplicateRows count=3}.
     */
    public String getDetail() {
        return getMessage();
    }
}
