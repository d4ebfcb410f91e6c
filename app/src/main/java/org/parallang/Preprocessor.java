package org.parallang;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Line-based macro expansion that runs before scanning.
 *
 * <ul>
 *   <li>{@code #define NAME value} records a macro, the line itself is dropped</li>
 *   <li>{@code #include "file"} is replaced by the preprocessed file, resolved
 *       against the directory of the including file</li>
 *   <li>any other line has every macro replaced, in definition order</li>
 * </ul>
 *
 * Every line of output ends with {@code \n}. Macros defined in an included
 * file stay visible to the including file after the include.
 */
public class Preprocessor {
    private static final String DEFINE = "#define ";
    private static final String INCLUDE = "#include ";

    private static final Logger log = LogManager.getLogger("preprocessor");

    private final Map<String, String> macros = new LinkedHashMap<>();
    private final Deque<Path> including = new ArrayDeque<>();

    public Map<String, String> macros() {
        return Collections.unmodifiableMap(macros);
    }

    // Preprocess text read from a file; includes resolve next to that file
    public String process(String code, Path file) {
        var normalized = file.toAbsolutePath().normalize();
        including.push(normalized);
        try {
            return expand(code, normalized.getParent());
        } finally {
            including.pop();
        }
    }

    // Preprocess text with no file behind it; includes resolve against the working directory
    public String process(String code) {
        return expand(code, null);
    }

    private String expand(String code, Path baseDir) {
        var output = new StringBuilder();
        for (var line : code.split("\n", -1)) {
            var trimmed = line.strip();
            if (trimmed.startsWith(DEFINE)) {
                define(trimmed.substring(DEFINE.length()));
                output.append('\n');
            } else if (trimmed.startsWith(INCLUDE)) {
                output.append(include(trimmed.substring(INCLUDE.length()).strip(), baseDir));
            } else {
                output.append(substitute(line)).append('\n');
            }
        }

        // split keeps a trailing empty piece when the code ends with a newline
        if (code.endsWith("\n") || code.isEmpty()) {
            output.setLength(output.length() - 1);
        }
        return output.toString();
    }

    private void define(String rest) {
        var body = rest.strip();
        int space = body.indexOf(' ');
        if (space < 0) {
            log.warn("ignoring #define without a value: " + body);
            return;
        }
        var name = body.substring(0, space);
        var value = body.substring(space + 1).strip();
        log.debug("define " + name + " = " + value);
        macros.put(name, value);
    }

    private String include(String quoted, Path baseDir) {
        if (quoted.length() < 2 || !quoted.startsWith("\"") || !quoted.endsWith("\"")) {
            log.warn("ignoring malformed #include: " + quoted);
            return "\n";
        }
        var name = quoted.substring(1, quoted.length() - 1);
        var path = (baseDir != null ? baseDir.resolve(name) : Path.of(name))
            .toAbsolutePath()
            .normalize();

        if (including.contains(path)) {
            log.warn("skipping recursive #include of " + path);
            return "\n";
        }

        String contents;
        try {
            contents = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("cannot read #include " + path + ": " + e.getMessage());
            return "\n";
        }

        log.debug("include " + path);
        var included = process(contents, path);
        return included.endsWith("\n") ? included : included + "\n";
    }

    private String substitute(String line) {
        var processed = line;
        for (var macro : macros.entrySet()) {
            processed = processed.replace(macro.getKey(), macro.getValue());
        }
        return processed;
    }
}
