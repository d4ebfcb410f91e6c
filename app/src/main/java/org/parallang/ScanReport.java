package org.parallang;

import java.util.List;

/**
 * Result of a scan that keeps going past invalid characters.
 *
 * {@code tokens} always ends with {@link TokenKind#END_OF_INPUT}; every
 * skipped character shows up in {@code errors}, in source order.
 */
public record ScanReport(List<Token> tokens, List<ScanError> errors) {
    public ScanReport {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    public boolean ok() {
        return errors.isEmpty();
    }
}
