// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

/**
 * ANSI color codes for debug output.
 *
 * <p>
 * Every constant is the empty string unless stdout is a console or
 * {@code FORCE_COLOR=true} is set.
 */
final class AnsiColors {

    private static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    static final String RESET = ansi("0");
    static final String TEAL = ansi("38;5;44");
    static final String CORAL = ansi("38;5;204");
    static final String INDIGO = ansi("38;5;99");
    static final String AMBER = ansi("38;5;214");
    static final String SLATE = ansi("38;5;247");
    static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
