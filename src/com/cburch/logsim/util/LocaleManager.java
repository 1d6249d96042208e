/* Copyright (c) 2010, Carl Burch. License information is located in the
 * com.cburch.logisim.Main source code and at www.cburch.com/logisim/. */

package com.cburch.logsim.util;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Thin wrapper over a {@link ResourceBundle} family. A missing key is returned
 * verbatim so that an incomplete translation never breaks error reporting.
 */
public class LocaleManager {
    private final String bundleName;
    private Locale locale;
    private ResourceBundle bundle;

    public LocaleManager(String dirName, String fileStart) {
        this.bundleName = dirName.replace('/', '.') + "." + fileStart;
        setLocale(Locale.getDefault());
    }

    public synchronized void setLocale(Locale locale) {
        this.locale = locale;
        this.bundle = null;
    }

    public synchronized Locale getLocale() {
        return locale;
    }

    public String get(String key) {
        ResourceBundle b = loadBundle();
        if (b == null) return key;
        try {
            return b.getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
    }

    private synchronized ResourceBundle loadBundle() {
        if (bundle == null) {
            try {
                bundle = ResourceBundle.getBundle(bundleName, locale,
                        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
            } catch (MissingResourceException e) {
                return null;
            }
        }
        return bundle;
    }
}
