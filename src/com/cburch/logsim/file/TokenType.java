package com.cburch.logsim.file;

public enum TokenType {
    KEYWORD,
    NAME,
    NUMBER,
    COMMA,
    SEMICOLON,
    COLON,
    ARROW,
    DOT,
    ERROR,
    EOF
}
