package com.cburch.logsim.file;

import com.cburch.logsim.data.Name;

/**
 * Lexeme produced by the {@link Scanner}.
 *
 * @param type   token type
 * @param name   interned handle for KEYWORD and NAME tokens, null otherwise
 * @param text   source text of the token (digits are kept as written)
 * @param error  what went wrong, for ERROR tokens only
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(TokenType type, Name name, String text, ErrorType error, int line, int column) {

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    @Override
    public String toString() {
        return type + (text.isEmpty() ? "" : " '" + text + "'") + " @" + line + ":" + column;
    }
}
