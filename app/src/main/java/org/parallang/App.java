package org.parallang;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class App {
    static final int EXIT_OK = 0;
    static final int EXIT_SCAN_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: app [--json] [--no-color] [--keep-going] [file]";

    private static final Logger log = LogManager.getLogger("app");

    // ==========================================================
    // MAIN PIPELINE
    // ==========================================================

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (options.help()) {
            out.println(USAGE);
            return EXIT_OK;
        }

        try {
            if (options.file().isPresent()) {
                return runFile(options.file().get(), options, out, err);
            }
            return runRepl(in, options, out, err);
        } catch (IOException e) {
            log.error("I/O failure", e);
            err.println("Critical I/O Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    // ==========================================================
    // OPTIONS
    // ==========================================================

    record Options(boolean json, boolean color, boolean keepGoing, boolean help, Optional<Path> file) {
        static Options parse(String[] args) {
            boolean json = false;
            boolean color = true;
            boolean keepGoing = false;
            boolean help = false;
            Path file = null;

            for (var arg : args) {
                switch (arg) {
                    case "--json" -> json = true;
                    case "--no-color" -> color = false;
                    case "--keep-going" -> keepGoing = true;
                    case "-h", "--help" -> help = true;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (file != null) {
                            throw new IllegalArgumentException("Only one input file is accepted");
                        }
                        file = Paths.get(arg);
                    }
                }
            }
            return new Options(json, color, keepGoing, help, Optional.ofNullable(file));
        }
    }

    // ==========================================================
    // FILE MODE
    // ==========================================================

    private static int runFile(Path path, Options options, PrintStream out, PrintStream err) throws IOException {
        if (!Files.exists(path)) {
            err.println("Cannot find file: " + path);
            err.println("Current dir: " + System.getProperty("user.dir"));
            return EXIT_USAGE;
        }

        log.info("scanning " + path);
        var raw = Files.readString(path, StandardCharsets.UTF_8);
        var code = new Preprocessor().process(raw, path);
        return scanAndReport(code, options, out, err);
    }

    // ==========================================================
    // REPL MODE
    // ==========================================================

    private static int runRepl(InputStream in, Options options, PrintStream out, PrintStream err) throws IOException {
        out.println("Parallang scanner REPL. Type 'exit' to quit.");
        // macros survive from one line to the next
        var preprocessor = new Preprocessor();
        var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print("> ");
            out.flush();
            var line = reader.readLine();
            if (line == null) {
                break;
            }
            line = line.strip();
            if (line.equals("exit")) {
                break;
            }
            if (!line.isEmpty()) {
                scanAndReport(preprocessor.process(line), options, out, err);
            }
        }
        return EXIT_OK;
    }

    // ==========================================================
    // SCANNING
    // ==========================================================

    static int scanAndReport(String code, Options options, PrintStream out, PrintStream err) {
        var scanner = new Scanner(code);
        List<Token> tokens;
        List<ScanError> errors;

        if (options.keepGoing()) {
            var report = scanner.tokenizeRecovering();
            tokens = report.tokens();
            errors = report.errors();
        } else {
            try {
                tokens = scanner.tokenizeAll();
                errors = List.of();
            } catch (ScanException e) {
                log.debug("scan aborted after " + e.partialTokens().size() + " tokens");
                err.println(Diagnostics.render(code, e.error()));
                return EXIT_SCAN_ERROR;
            }
        }

        var index = new LineIndex(code);
        for (var error : errors) {
            err.println(Diagnostics.render(index, error));
        }

        if (options.json()) {
            out.println(TokenJson.toJson(tokens));
        } else {
            out.println(TokenTable.format(tokens));
            if (options.color()) {
                out.println("\nColorized output:");
                out.println(Highlighter.colorize(code, tokens, errors));
            }
        }

        return errors.isEmpty() ? EXIT_OK : EXIT_SCAN_ERROR;
    }
}
