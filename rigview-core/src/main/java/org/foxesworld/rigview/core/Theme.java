package org.foxesworld.rigview.core;

import com.formdev.flatlaf.FlatDarkLaf;
import com.formdev.flatlaf.FlatLaf;
import com.formdev.flatlaf.FlatPropertiesLaf;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InputStream;

/** Look-and-feel for the launcher's settings dialog. */
public final class Theme {

    private static final Logger log = LogManager.getLogger(Theme.class);

    private Theme() {}

    /**
     * Installs a FlatLaf properties theme from the classpath.
     * Falls back to {@link FlatDarkLaf} when the path is missing or unreadable.
     *
     * @return true when the requested theme was installed
     */
    public static boolean setupTheme(String theme) {
        if (theme == null || theme.isBlank()) {
            FlatLaf.setup(new FlatDarkLaf());
            return false;
        }
        try (InputStream themeStream = Theme.class.getClassLoader().getResourceAsStream(theme)) {
            if (themeStream == null) {
                throw new IllegalStateException("Theme " + theme + " file not found in resources");
            }
            FlatPropertiesLaf laf = new FlatPropertiesLaf("Dark Theme", themeStream);
            FlatLaf.setup(laf);
            return true;
        } catch (Exception ex) {
            log.warn("Theme '{}' not applied, using FlatDarkLaf: {}", theme, ex.toString());
            FlatLaf.setup(new FlatDarkLaf());
            return false;
        }
    }
}
