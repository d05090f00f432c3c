package org.healthplatform.warehouse.parse;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/**
 * One fetched snapshot: its bytes and the format detected for them.
 */
public final class RawBatch {

    private final String objectName;
    private final byte[] payload;
    private final SourceFormat format;

    private RawBatch(String objectName, byte[] payload, SourceFormat format) {
        this.objectName = objectName;
        this.payload = payload;
        this.format = format;
    }

    /**
     * Wraps a fetched payload without copying it, detecting its format from the leading bytes.
     * The caller hands over the array and must not modify it afterwards.
     */
    public static RawBatch of(String objectName, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new RawBatch(objectName, payload, FormatSniffer.detect(payload));
    }

    public String getObjectName() {
        return objectName;
    }

    public SourceFormat getFormat() {
        return format;
    }

    public int size() {
        return payload.length;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(payload);
    }
}
