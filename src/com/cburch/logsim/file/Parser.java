package com.cburch.logsim.file;

import com.cburch.logsim.circuit.Network;
import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.DeviceFactoryRegistry;
import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.auxiliary.PinRef;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.comp.specs.DeviceSpec;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.monitor.MonitorPoint;
import com.cburch.logsim.monitor.Monitors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive-descent parser for definition files:
 * <pre>
 * DEVICES name : kind [qualifier] {, ...} ;
 * CONNECT pin &gt; pin {, ...} ;
 * MONITOR pin {, ...} ;
 * END
 * </pre>
 * It builds the network and monitors as it goes and never stops at the first
 * problem: after a syntax error it skips to the next comma, semicolon or
 * section keyword and carries on. A declaration that fails a semantic check is
 * skipped without touching the network.
 */
final class Parser {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Scanner scanner;
    private final Keywords keywords;
    private final Network network;
    private final Monitors monitors;
    private final DeviceFactoryRegistry registry;
    private final DiagnosticCollector diagnostics;

    // Token donde se declaró cada dispositivo, para ubicar errores tardíos
    private final Map<Name, Token> declaredAt = new HashMap<>();

    private Token tok;
    private Token first;

    /** Syntax error inside one list item; the list recovers from it. */
    private static final class ItemSyntaxError extends Exception {
        final ErrorType type;
        final Token at;
        final Object[] args;

        ItemSyntaxError(ErrorType type, Token at, Object... args) {
            super(type.key(), null, false, false);
            this.type = type;
            this.at = at;
            this.args = args;
        }
    }

    @FunctionalInterface
    private interface ItemParser {
        void parse() throws ItemSyntaxError;
    }

    Parser(Scanner scanner, Network network, Monitors monitors,
           DeviceFactoryRegistry registry, DiagnosticCollector diagnostics) {
        this.scanner = scanner;
        this.keywords = scanner.keywords();
        this.network = network;
        this.monitors = monitors;
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    /** Parses the whole definition. Problems end up in the collector. */
    void parse() {
        advance();
        first = tok;
        if (first.isEof()) {
            diagnostics.error(ErrorType.EMPTY_DEFINITION, first);
            LOGGER.info("Definition is empty");
            return;
        }
        boolean sawEnd = false;

        while (!tok.isEof()) {
            if (tok.is(TokenType.ERROR)) {
                diagnostics.error(tok.error(), tok, tok.text());
                advance();
            } else if (isKeyword(keywords.devices())) {
                advance();
                list(this::device);
            } else if (isKeyword(keywords.connect())) {
                advance();
                list(this::connection);
            } else if (isKeyword(keywords.monitor())) {
                advance();
                list(this::monitor);
            } else if (isKeyword(keywords.end())) {
                sawEnd = true;
                advance();
                if (!tok.isEof()) diagnostics.error(ErrorType.TEXT_AFTER_END, tok);
                break;
            } else {
                diagnostics.error(ErrorType.EXPECTED_SECTION, tok);
                // saltar hasta la siguiente sección
                do {
                    advance();
                } while (!tok.isEof() && !atSection());
            }
        }

        if (!sawEnd) diagnostics.error(ErrorType.EXPECTED_END, tok);
        checkComplete();

        LOGGER.info("Parsed {} devices, {} connections, {} monitors with {} error(s)",
                network.size(), network.connections().size(), monitors.size(), diagnostics.errorCount());
    }

    /* ===== Listas ===== */

    /**
     * {@code item (, item)* ;} with recovery. Returns once the closing
     * semicolon is consumed, or at a section keyword or EOF.
     */
    private void list(ItemParser item) {
        while (true) {
            try {
                item.parse();
            } catch (ItemSyntaxError e) {
                if (atSection()) {
                    diagnostics.error(ErrorType.MISSING_SEMICOLON, tok);
                    return;
                }
                if (tok.isEof()) return;
                diagnostics.error(e.type, e.at, e.args);
                skipToBoundary();
            }

            if (tok.is(TokenType.COMMA)) {
                advance();
            } else if (tok.is(TokenType.SEMICOLON)) {
                advance();
                return;
            } else if (atSection()) {
                diagnostics.error(ErrorType.MISSING_SEMICOLON, tok);
                return;
            } else if (tok.isEof()) {
                return;
            } else {
                ErrorType t = tok.is(TokenType.ERROR) ? tok.error() : ErrorType.EXPECTED_SEPARATOR;
                diagnostics.error(t, tok, tok.text());
                skipToBoundary();
                if (tok.is(TokenType.COMMA)) {
                    advance();
                } else if (tok.is(TokenType.SEMICOLON)) {
                    advance();
                    return;
                } else {
                    if (atSection()) diagnostics.error(ErrorType.MISSING_SEMICOLON, tok);
                    return;
                }
            }
        }
    }

    /* ===== DEVICES ===== */

    private void device() throws ItemSyntaxError {
        Token nameTok = tok;
        if (!tok.is(TokenType.NAME)) throw syntax(ErrorType.EXPECTED_DEVICE_NAME);
        Name name = tok.name();
        advance();

        if (!tok.is(TokenType.COLON)) throw syntax(ErrorType.EXPECTED_COLON);
        advance();

        Token kindTok = tok;
        Optional<DeviceKind> kind = tok.is(TokenType.KEYWORD) ? keywords.kindOf(tok.name()) : Optional.empty();
        if (kind.isEmpty()) {
            if (!tok.is(TokenType.NAME)) throw syntax(ErrorType.EXPECTED_DEVICE_KIND);
            // nombre que no es un tipo: error semántico, se descarta la declaración
            diagnostics.error(ErrorType.UNKNOWN_DEVICE_KIND, kindTok, kindTok.text());
            advance();
            if (tok.is(TokenType.NUMBER)) advance();
            return;
        }
        advance();

        Token qualifierTok = tok;
        String qualifier = null;
        if (tok.is(TokenType.NUMBER)) {
            qualifier = tok.text();
            advance();
        }

        if (network.device(name).isPresent()) {
            diagnostics.error(ErrorType.DUPLICATE_DEVICE, nameTok, name);
            skipUnlessBoundary();
            return;
        }
        try {
            Device d = registry.create(new DeviceSpec(name, kind.get(), qualifier));
            network.addDevice(d);
            declaredAt.put(name, nameTok);
        } catch (NetworkException e) {
            diagnostics.error(e.type(), qualifierTok, e.args());
            skipUnlessBoundary();
        }
    }

    /* ===== CONNECT ===== */

    private void connection() throws ItemSyntaxError {
        Token fromTok = tok;
        PinRef from = pinRef();

        if (!tok.is(TokenType.ARROW)) throw syntax(ErrorType.EXPECTED_ARROW);
        advance();

        Token toTok = tok;
        PinRef to = pinRef();

        try {
            network.resolveSource(from);
        } catch (NetworkException e) {
            diagnostics.error(e.type(), fromTok, e.args());
            return;
        }
        try {
            network.connect(from, to);
        } catch (NetworkException e) {
            diagnostics.error(e.type(), toTok, e.args());
        }
    }

    /* ===== MONITOR ===== */

    private void monitor() throws ItemSyntaxError {
        Token at = tok;
        PinRef ref = pinRef();
        try {
            monitors.add(MonitorPoint.of(ref));
        } catch (NetworkException e) {
            diagnostics.error(e.type(), at, e.args());
        }
    }

    /** {@code device [. pin]} */
    private PinRef pinRef() throws ItemSyntaxError {
        if (!tok.is(TokenType.NAME)) throw syntax(ErrorType.EXPECTED_DEVICE_NAME);
        Name device = tok.name();
        advance();
        if (!tok.is(TokenType.DOT)) return PinRef.of(device);
        advance();
        if (!tok.is(TokenType.NAME)) throw syntax(ErrorType.EXPECTED_PIN_NAME);
        Name pin = tok.name();
        advance();
        return new PinRef(device, pin);
    }

    /* ===== Comprobaciones finales ===== */

    private void checkComplete() {
        // sólo si no hubo errores: si no, cada conexión fallida daría otro error en cascada
        if (diagnostics.hasErrors()) return;

        if (network.size() == 0) {
            diagnostics.error(ErrorType.EMPTY_DEFINITION, first);
            return;
        }
        for (InputPin in : network.unboundInputs()) {
            Token at = declaredAt.getOrDefault(in.owner().name(), first);
            diagnostics.error(ErrorType.INPUT_NOT_CONNECTED, at, in.ref());
        }
    }

    /* ===== Helpers ===== */

    private void advance() {
        tok = scanner.nextToken();
    }

    private boolean isKeyword(Name n) {
        return tok.is(TokenType.KEYWORD) && n.equals(tok.name());
    }

    private boolean atSection() {
        return tok.is(TokenType.KEYWORD) && keywords.isSection(tok.name());
    }

    private boolean atBoundary() {
        return tok.is(TokenType.COMMA) || tok.is(TokenType.SEMICOLON) || tok.isEof() || atSection();
    }

    /** Discards tokens up to (not including) the next comma, semicolon, section keyword or EOF. */
    private void skipToBoundary() {
        while (!atBoundary()) advance();
    }

    private void skipUnlessBoundary() {
        if (!atBoundary()) skipToBoundary();
    }

    /** Error at the current token; an ERROR token reports its own problem instead. */
    private ItemSyntaxError syntax(ErrorType expected) {
        if (tok.is(TokenType.ERROR)) return new ItemSyntaxError(tok.error(), tok, tok.text());
        return new ItemSyntaxError(expected, tok);
    }
}
