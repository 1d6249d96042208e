package com.cburch.logsim.file;

import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.SymbolTable;

import java.util.Objects;

/**
 * Turns definition text into tokens, one call at a time.
 * <p>
 * Whitespace, {@code # line} comments and {@code /* block *&#47;} comments are
 * skipped. Malformed input never throws: it comes back as an ERROR token and
 * scanning carries on after it. After the first EOF every call returns EOF.
 */
public final class Scanner {
    private final String src;
    private final SymbolTable symbols;
    private final Keywords keywords;
    private final SourceText text;

    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean pendingEof;

    public Scanner(String source, SymbolTable symbols) {
        this.src = Objects.requireNonNull(source, "source");
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.keywords = new Keywords(symbols);
        this.text = new SourceText(source);
    }

    public Keywords keywords() {
        return keywords;
    }

    public SourceText sourceText() {
        return text;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public Token nextToken() {
        if (pendingEof) return token(TokenType.EOF, null, "", null, line, column);

        Token err = skipBlanks();
        if (err != null) return err;

        int l = line, c = column;
        if (pos >= src.length()) {
            pendingEof = true;
            return token(TokenType.EOF, null, "", null, l, c);
        }

        char ch = src.charAt(pos);
        if (isLetter(ch)) {
            String word = readWhile(true);
            Name n = symbols.lookup(word);
            TokenType t = keywords.isReserved(n) ? TokenType.KEYWORD : TokenType.NAME;
            return token(t, n, word, null, l, c);
        }
        if (isDigit(ch)) {
            return token(TokenType.NUMBER, null, readWhile(false), null, l, c);
        }

        advance();
        return switch (ch) {
            case ',' -> token(TokenType.COMMA, null, ",", null, l, c);
            case ';' -> token(TokenType.SEMICOLON, null, ";", null, l, c);
            case ':' -> token(TokenType.COLON, null, ":", null, l, c);
            case '>' -> token(TokenType.ARROW, null, ">", null, l, c);
            case '.' -> token(TokenType.DOT, null, ".", null, l, c);
            default -> token(TokenType.ERROR, null, String.valueOf(ch), ErrorType.INVALID_CHARACTER, l, c);
        };
    }

    /* ===== Helpers ===== */

    /**
     * Skips whitespace and comments.
     *
     * @return an ERROR token for an unterminated block comment, else null
     */
    private Token skipBlanks() {
        while (pos < src.length()) {
            char ch = src.charAt(pos);
            if (Character.isWhitespace(ch)) {
                advance();
            } else if (ch == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n') advance();
            } else if (ch == '/' && pos + 1 < src.length() && src.charAt(pos + 1) == '*') {
                int l = line, c = column;
                advance();
                advance();
                boolean closed = false;
                while (pos < src.length()) {
                    if (src.charAt(pos) == '*' && pos + 1 < src.length() && src.charAt(pos + 1) == '/') {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    advance();
                }
                if (!closed) {
                    // el resto del archivo era comentario
                    pendingEof = true;
                    return token(TokenType.ERROR, null, "/*", ErrorType.UNTERMINATED_COMMENT, l, c);
                }
            } else {
                return null;
            }
        }
        return null;
    }

    private String readWhile(boolean alnum) {
        int start = pos;
        while (pos < src.length()) {
            char ch = src.charAt(pos);
            boolean ok = alnum ? (isLetter(ch) || isDigit(ch)) : isDigit(ch);
            if (!ok) break;
            advance();
        }
        return src.substring(start, pos);
    }

    // sólo ASCII: 'é' o '٣' son caracteres inválidos
    private static boolean isLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private void advance() {
        char ch = src.charAt(pos++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else if (ch == '\r') {
            // \r\n cuenta como un solo salto
            if (pos < src.length() && src.charAt(pos) == '\n') return;
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private static Token token(TokenType type, Name name, String text, ErrorType error, int line, int column) {
        return new Token(type, name, text, error, line, column);
    }
}
