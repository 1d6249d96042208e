/* Copyright (c) 2010, Carl Burch. License information is located in the
 * com.cburch.logisim.Main source code and at www.cburch.com/logisim/. */

package com.cburch.logsim.util;

public class StringUtil {
    private StringUtil() { }

    /* ================== API PÚBLICA ================== */

    /**
     * Replaces {@code %s} placeholders sequentially and {@code %$1}..{@code %$9}
     * by position. {@code %%} yields a single percent sign.
     */
    public static String format(String fmt, Object... args) {
        String[] text = new String[args == null ? 0 : args.length];
        for (int i = 0; i < text.length; i++) {
            text[i] = (args[i] == null) ? "(null)" : String.valueOf(args[i]);
        }
        return formatImpl(fmt, text);
    }

    /** Builds a line with {@code column - 1} spaces followed by a caret. */
    public static String caretLine(int column) {
        return " ".repeat(Math.max(0, column - 1)) + "^";
    }

    /** @return true si el texto no está vacío y sólo contiene '0' y '1' */
    public static boolean isBinary(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '0' && c != '1') return false;
        }
        return true;
    }

    /* ================== IMPLEMENTACIÓN ================== */

    private static String formatImpl(String fmt, String... args) {
        if (fmt == null) return "";

        StringBuilder ret = new StringBuilder();
        int pos = 0;
        int next = fmt.indexOf('%');
        int argSeq = 0; // para los %s secuenciales

        while (next >= 0) {
            ret.append(fmt, pos, next);

            // % al final → lo dejamos literal
            if (next + 1 >= fmt.length()) {
                ret.append('%');
                pos = next + 1;
                break;
            }

            char c = fmt.charAt(next + 1);
            switch (c) {
                case 's' -> {
                    ret.append(argSeq < args.length ? args[argSeq] : "(null)");
                    argSeq++;
                    pos = next + 2;
                }
                case '$' -> {
                    int idx = (next + 2 < fmt.length()) ? Character.digit(fmt.charAt(next + 2), 10) - 1 : -1;
                    if (idx >= 0 && idx < args.length) {
                        ret.append(args[idx]);
                        pos = next + 3;
                    } else {
                        ret.append("%$");
                        pos = next + 2;
                    }
                }
                case '%' -> {
                    ret.append('%');
                    pos = next + 2;
                }
                default -> {
                    // %x desconocido → dejar % y seguir
                    ret.append('%');
                    pos = next + 1;
                }
            }

            next = fmt.indexOf('%', pos);
        }

        if (pos < fmt.length()) {
            ret.append(fmt.substring(pos));
        }
        return ret.toString();
    }
}
