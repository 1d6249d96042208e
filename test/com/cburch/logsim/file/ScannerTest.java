package com.cburch.logsim.file;

import com.cburch.logsim.data.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScannerTest {

    private static List<Token> scan(String src) {
        Scanner s = new Scanner(src, new SymbolTable());
        List<Token> out = new ArrayList<>();
        Token t;
        do {
            t = s.nextToken();
            out.add(t);
        } while (!t.isEof());
        return out;
    }

    private static List<TokenType> types(String src) {
        return scan(src).stream().map(Token::type).toList();
    }

    @Test
    void deviceDeclaration() {
        assertEquals(List.of(TokenType.KEYWORD, TokenType.NAME, TokenType.COLON, TokenType.KEYWORD,
                        TokenType.NUMBER, TokenType.SEMICOLON, TokenType.EOF),
                types("DEVICES G1:AND 2;"));
    }

    @Test
    void qualifiedPinAndArrow() {
        List<Token> toks = scan("D1.QBAR > D1.DATA");
        assertEquals(List.of(TokenType.NAME, TokenType.DOT, TokenType.NAME, TokenType.ARROW,
                TokenType.NAME, TokenType.DOT, TokenType.NAME, TokenType.EOF),
                toks.stream().map(Token::type).toList());
        assertEquals("QBAR", toks.get(2).text());
        // mismo nombre, mismo handle
        assertEquals(toks.get(0).name(), toks.get(4).name());
    }

    @Test
    void keywordsAreCaseSensitive() {
        List<Token> toks = scan("END end And");
        assertEquals(TokenType.KEYWORD, toks.get(0).type());
        assertEquals(TokenType.NAME, toks.get(1).type());
        assertEquals(TokenType.NAME, toks.get(2).type());
    }

    @Test
    void numbersKeepLeadingZeros() {
        Token t = scan("0011").get(0);
        assertEquals(TokenType.NUMBER, t.type());
        assertEquals("0011", t.text());
    }

    @Test
    void positionsAreOneBasedAndIncrease() {
        List<Token> toks = scan("DEVICES\n  A : NOT;\n\tEND");
        Token a = toks.get(1);
        assertEquals(2, a.line());
        assertEquals(3, a.column());
        Token end = toks.get(5);
        assertEquals("END", end.text());
        assertEquals(3, end.line());
        assertEquals(2, end.column());
        for (int i = 1; i < toks.size(); i++) {
            Token p = toks.get(i - 1), c = toks.get(i);
            assertTrue(c.line() > p.line() || (c.line() == p.line() && c.column() >= p.column()));
        }
    }

    @Test
    void lineAndBlockCommentsAreSkipped() {
        assertEquals(List.of(TokenType.KEYWORD, TokenType.KEYWORD, TokenType.EOF),
                types("# heading\nDEVICES /* a\n multi-line\n note */ END # trailing"));
    }

    @Test
    void unterminatedCommentIsAnErrorThenEof() {
        List<Token> toks = scan("END /* never closed");
        assertEquals(TokenType.ERROR, toks.get(1).type());
        assertEquals(ErrorType.UNTERMINATED_COMMENT, toks.get(1).error());
        assertEquals(5, toks.get(1).column());
        assertEquals(TokenType.EOF, toks.get(2).type());
    }

    @Test
    void unknownCharacterDoesNotStopScanning() {
        List<Token> toks = scan("A $ B");
        assertEquals(TokenType.ERROR, toks.get(1).type());
        assertEquals(ErrorType.INVALID_CHARACTER, toks.get(1).error());
        assertEquals("$", toks.get(1).text());
        assertEquals(TokenType.NAME, toks.get(2).type());
    }

    @Test
    void identifiersAreAsciiOnly() {
        List<Token> toks = scan("Aé ٣ B2");
        assertEquals("A", toks.get(0).text());
        assertEquals(TokenType.ERROR, toks.get(1).type());
        assertEquals(ErrorType.INVALID_CHARACTER, toks.get(1).error());
        assertEquals("é", toks.get(1).text());
        assertEquals(TokenType.ERROR, toks.get(2).type());
        assertEquals("٣", toks.get(2).text());
        assertEquals(TokenType.NAME, toks.get(3).type());
        assertEquals("B2", toks.get(3).text());
    }

    @Test
    void eofRepeats() {
        Scanner s = new Scanner("", new SymbolTable());
        assertTrue(s.nextToken().isEof());
        assertTrue(s.nextToken().isEof());
    }

    @Test
    void crlfCountsAsOneLine() {
        List<Token> toks = scan("A\r\nB\rC");
        assertEquals(1, toks.get(0).line());
        assertEquals(2, toks.get(1).line());
        assertEquals(3, toks.get(2).line());
    }
}
