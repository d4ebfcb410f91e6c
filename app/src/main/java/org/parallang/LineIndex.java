package org.parallang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Offsets at which each line of a source text starts.
 *
 * Lets error reporting go from a {@link Position} back to the text of the
 * line it sits on, and from a raw offset to a line/column pair.
 */
public class LineIndex {
    private final String source;
    private final List<Integer> lineStarts = new ArrayList<>();

    public LineIndex(String source) {
        this.source = source;
        this.lineStarts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                this.lineStarts.add(i + 1);
            }
        }
    }

    public int lineCount() {
        return lineStarts.size();
    }

    // Returns the 1-based position of a 0-based offset
    public Position locate(int offset) {
        if (offset < 0 || offset > source.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside of 0.." + source.length());
        }
        var lineFind = Collections.binarySearch(lineStarts, offset);

        int lineIdx;
        if (lineFind >= 0) {
            lineIdx = lineFind;
        } else {
            // binarySearch returns (-(insertion_point) - 1) so we reverse that
            lineIdx = -(lineFind + 1) - 1;
        }

        int lineStart = lineStarts.get(lineIdx);
        int column = source.codePointCount(lineStart, offset) + 1;
        return new Position(offset, lineIdx + 1, column);
    }

    // Text of a 1-based line, without its line terminator
    public String lineText(int line) {
        if (line < 1 || line > lineStarts.size()) {
            throw new IndexOutOfBoundsException("line " + line + " outside of 1.." + lineStarts.size());
        }
        int from = lineStarts.get(line - 1);
        int to = line < lineStarts.size() ? lineStarts.get(line) - 1 : source.length();
        if (to > from && source.charAt(to - 1) == '\r') {
            to--;
        }
        return source.substring(from, to);
    }
}
