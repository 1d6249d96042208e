package com.cburch.logsim.file;

/**
 * One problem found while reading a definition.
 *
 * @param type     what kind of problem
 * @param message  localized text
 * @param line     1-based line
 * @param column   1-based column
 */
public record Diagnostic(ErrorType type, String message, int line, int column) {

    public static Diagnostic error(ErrorType type, Token at, Object... args) {
        return new Diagnostic(type, type.format(args), at.line(), at.column());
    }

    @Override
    public String toString() {
        return line + ":" + column + ": " + message;
    }
}
