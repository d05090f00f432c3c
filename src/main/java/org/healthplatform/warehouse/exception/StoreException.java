package org.healthplatform.warehouse.exception;

/**
 * Listing or fetching from the staging store failed, including an empty listing.
 */
public class StoreException extends TransformException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
