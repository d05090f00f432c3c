package org.healthplatform.warehouse.parse;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Test payloads, from classpath fixtures or inline text.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static byte[] resource(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RawBatch batch(String objectName, String content) {
        return RawBatch.of(objectName, content.getBytes(StandardCharsets.UTF_8));
    }
}
