package org.healthplatform.warehouse.parse;

import java.nio.charset.StandardCharsets;

/**
 * Classifies a payload from its first bytes. A heuristic only: malformed payloads
 * are rejected later by the parser.
 */
public final class FormatSniffer {

    static final int PEEK_BYTES = 50;

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private FormatSniffer() {
    }

    public static SourceFormat detect(byte[] payload) {
        int length = Math.min(PEEK_BYTES, payload.length);
        // A multi-byte character cut at the peek boundary decodes to U+FFFD, which is harmless here
        String peek = new String(payload, 0, length, StandardCharsets.UTF_8);
        for (int i = 0; i < peek.length(); i++) {
            char c = peek.charAt(i);
            if (c == BYTE_ORDER_MARK || Character.isWhitespace(c)) {
                continue;
            }
            return c == '{' ? SourceFormat.STRUCTURED : SourceFormat.TABULAR;
        }
        return SourceFormat.TABULAR;
    }
}
