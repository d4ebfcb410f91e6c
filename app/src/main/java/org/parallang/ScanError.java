package org.parallang;

/**
 * An invalid character met by the scanner.
 *
 * This is the only failure the scanner knows about. The character is kept as
 * a code point so that characters outside the BMP are reported whole.
 */
public record ScanError(int codePoint, Position position) {
    public static final String CODE = "E101";

    public String character() {
        return new String(Character.toChars(codePoint));
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public String message() {
        return "unexpected symbol: " + printable();
    }

    // Control characters and unpaired surrogates are shown escaped, everything else as-is
    String printable() {
        return switch (codePoint) {
            case '\t' -> "\\t";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            default -> Character.isISOControl(codePoint) || isLoneSurrogate()
                ? String.format("\\u%04X", codePoint)
                : character();
        };
    }

    private boolean isLoneSurrogate() {
        return Character.isBmpCodePoint(codePoint) && Character.isSurrogate((char) codePoint);
    }

    @Override
    public String toString() {
        return "InvalidCharacter(" + printable() + ", line=" + line() + ", column=" + column() + ")";
    }
}
