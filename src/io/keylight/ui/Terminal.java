package io.keylight.ui;

import java.io.PrintStream;

public class Terminal {
    static final String BG_GRN_ON = "\033[42m";
    static final String BG_WHITE_ON = "\033[47m";
    static final String BG_OFF = "\033[0m";

    private Terminal() {}

    public static void carriageReturn(PrintStream out) {
        out.print("\r");
        out.flush();
    }

    public static void clearFromCursor(PrintStream out) {
        out.print("\033[K");
        out.flush();
    }
}
