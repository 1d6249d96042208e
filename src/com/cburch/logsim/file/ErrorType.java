package com.cburch.logsim.file;

/**
 * Every problem the front end or the engine can report, with its category
 * and the message key used to render it.
 */
public enum ErrorType {
    // ---- Sintaxis ----
    EXPECTED_SECTION       (Category.SYNTAX,   "error.expectedSection"),
    EXPECTED_SEPARATOR     (Category.SYNTAX,   "error.expectedSeparator"),
    MISSING_SEMICOLON      (Category.SYNTAX,   "error.missingSemicolon"),
    EXPECTED_COLON         (Category.SYNTAX,   "error.expectedColon"),
    EXPECTED_ARROW         (Category.SYNTAX,   "error.expectedArrow"),
    EXPECTED_DEVICE_NAME   (Category.SYNTAX,   "error.expectedDeviceName"),
    EXPECTED_DEVICE_KIND   (Category.SYNTAX,   "error.expectedDeviceKind"),
    EXPECTED_PIN_NAME      (Category.SYNTAX,   "error.expectedPinName"),
    EXPECTED_END           (Category.SYNTAX,   "error.expectedEnd"),
    TEXT_AFTER_END         (Category.SYNTAX,   "error.textAfterEnd"),
    INVALID_CHARACTER      (Category.SYNTAX,   "error.invalidCharacter"),
    UNTERMINATED_COMMENT   (Category.SYNTAX,   "error.unterminatedComment"),

    // ---- Semántica: dispositivos ----
    DUPLICATE_DEVICE       (Category.SEMANTIC, "error.duplicateDevice"),
    UNKNOWN_DEVICE_KIND    (Category.SEMANTIC, "error.unknownDeviceKind"),
    MISSING_ARITY          (Category.SEMANTIC, "error.missingArity"),
    INVALID_ARITY          (Category.SEMANTIC, "error.invalidArity"),
    MISSING_PERIOD         (Category.SEMANTIC, "error.missingPeriod"),
    INVALID_PERIOD         (Category.SEMANTIC, "error.invalidPeriod"),
    INVALID_SWITCH_STATE   (Category.SEMANTIC, "error.invalidSwitchState"),
    MISSING_WAVEFORM       (Category.SEMANTIC, "error.missingWaveform"),
    INVALID_WAVEFORM       (Category.SEMANTIC, "error.invalidWaveform"),
    UNEXPECTED_QUALIFIER   (Category.SEMANTIC, "error.unexpectedQualifier"),
    NUMBER_TOO_LARGE       (Category.SEMANTIC, "error.numberTooLarge"),
    EMPTY_DEFINITION       (Category.SEMANTIC, "error.emptyDefinition"),

    // ---- Semántica: conexiones ----
    UNDEFINED_DEVICE       (Category.SEMANTIC, "error.undefinedDevice"),
    UNKNOWN_PIN            (Category.SEMANTIC, "error.unknownPin"),
    PIN_REQUIRED           (Category.SEMANTIC, "error.pinRequired"),
    INPUT_AS_SOURCE        (Category.SEMANTIC, "error.inputAsSource"),
    OUTPUT_AS_DESTINATION  (Category.SEMANTIC, "error.outputAsDestination"),
    INPUT_ALREADY_CONNECTED(Category.SEMANTIC, "error.inputAlreadyConnected"),
    INPUT_NOT_CONNECTED    (Category.SEMANTIC, "error.inputNotConnected"),

    // ---- Semántica: monitores ----
    MONITOR_NOT_OUTPUT     (Category.SEMANTIC, "error.monitorNotOutput"),
    DUPLICATE_MONITOR      (Category.SEMANTIC, "error.duplicateMonitor"),
    MONITOR_CAPACITY       (Category.SEMANTIC, "error.monitorCapacity"),
    NOT_MONITORED          (Category.SEMANTIC, "error.notMonitored"),

    // ---- Ejecución ----
    NO_CONVERGENCE         (Category.CONVERGENCE, "error.noConvergence");

    public enum Category { SYNTAX, SEMANTIC, CONVERGENCE }

    private final Category category;
    private final String key;

    ErrorType(Category category, String key) {
        this.category = category;
        this.key = key;
    }

    public Category category() { return category; }
    public String key() { return key; }

    public boolean isSyntax()   { return category == Category.SYNTAX; }
    public boolean isSemantic() { return category == Category.SEMANTIC; }

    /** Localized message with {@code %s} arguments filled in. */
    public String format(Object... args) {
        return Strings.get(key, args);
    }
}
