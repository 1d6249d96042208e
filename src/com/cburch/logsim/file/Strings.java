/* Copyright (c) 2010, Carl Burch. License information is located in the
 * com.cburch.logisim.Main source code and at www.cburch.com/logisim/. */

package com.cburch.logsim.file;

import com.cburch.logsim.util.LocaleManager;
import com.cburch.logsim.util.StringUtil;

import java.util.Locale;

public class Strings {
    private static final LocaleManager source
            = new LocaleManager("resources/logsim", "logsim");

    private Strings() { }

    public static String get(String key) {
        return source.get(key);
    }

    public static String get(String key, Object... args) {
        return StringUtil.format(source.get(key), args);
    }

    public static void setLocale(Locale locale) {
        source.setLocale(locale);
    }

    public static Locale getLocale() {
        return source.getLocale();
    }
}
