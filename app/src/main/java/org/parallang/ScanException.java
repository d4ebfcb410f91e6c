package org.parallang;

import java.util.List;

/**
 * Thrown when the scanner meets an invalid character.
 *
 * When raised from {@link Scanner#tokenizeAll()}, the tokens scanned before
 * the error are kept in {@link #partialTokens()} for diagnostics.
 */
public class ScanException extends RuntimeException {
    private final ScanError error;
    private final List<Token> partialTokens;

    public ScanException(ScanError error) {
        this(error, List.of());
    }

    public ScanException(ScanError error, List<Token> partialTokens) {
        this(error, partialTokens, null);
    }

    public ScanException(ScanError error, List<Token> partialTokens, Throwable cause) {
        super(formatMessage(error), cause);
        this.error = error;
        this.partialTokens = List.copyOf(partialTokens);
    }

    public ScanError error() {
        return error;
    }

    public List<Token> partialTokens() {
        return partialTokens;
    }

    private static String formatMessage(ScanError error) {
        var pos = error.position();
        var span = String.format("%d,%d..%d,%d",
            pos.line(), pos.column(),
            pos.line(), pos.column()
        );
        return ScanError.CODE + ": in range of " + span
            + "\nErr: " + error.message();
    }
}
