package org.parallang.utils;

// Escape sequences for terminal colors
public final class AnsiColors {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_WHITE = "\u001B[37m";
    public static final String ANSI_RED_BACK = "\u001B[41m";

    private AnsiColors() {
    }
}
