package com.cburch.logsim.file;

import com.cburch.logsim.util.StringUtil;

import java.util.List;

/**
 * Source lines kept for diagnostics.
 */
public final class SourceText {
    private final List<String> lines;

    public SourceText(String source) {
        this.lines = List.of(source.split("\r\n|\r|\n", -1));
    }

    /** 1-based; empty string when out of range. */
    public String line(int number) {
        if (number < 1 || number > lines.size()) return "";
        return lines.get(number - 1);
    }

    /**
     * The line followed by a caret under {@code column}. Tabs before the
     * column are copied so the caret lines up in any tab width.
     */
    public String pointAt(int lineNumber, int column) {
        String text = line(lineNumber);
        StringBuilder pad = new StringBuilder();
        int upto = Math.min(Math.max(0, column - 1), text.length());
        for (int i = 0; i < upto; i++) pad.append(text.charAt(i) == '\t' ? '\t' : ' ');
        int rest = Math.max(0, column - 1 - upto);
        return text + "\n" + pad + StringUtil.caretLine(rest + 1);
    }
}
