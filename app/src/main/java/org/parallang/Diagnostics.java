package org.parallang;

/**
 * Formats scan errors for people.
 *
 * <pre>
 * 1:7: E101 unexpected symbol '@'
 * x = 1 @ 2;
 *       ^
 * </pre>
 */
public final class Diagnostics {
    private Diagnostics() {
    }

    public static String render(String source, ScanError error) {
        return render(new LineIndex(source), error);
    }

    public static String render(LineIndex index, ScanError error) {
        var pos = error.position();
        var sb = new StringBuilder();
        sb.append(pos).append(": ")
            .append(ScanError.CODE).append(" unexpected symbol '")
            .append(error.printable()).append("'\n");

        var text = index.lineText(pos.line());
        sb.append(text).append('\n');

        // Tabs are kept so the caret lines up in a terminal
        int before = text.offsetByCodePoints(0, Math.min(pos.column() - 1, text.codePointCount(0, text.length())));
        for (int i = 0; i < before; i++) {
            sb.append(text.charAt(i) == '\t' ? '\t' : ' ');
        }
        sb.append('^');
        return sb.toString();
    }
}
