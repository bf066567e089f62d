package org.foxesworld.rigview.engine;

import com.jme3.system.AppSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.core.RigViewVersion;
import org.foxesworld.rigview.engine.app.ViewerConfig;
import org.foxesworld.rigview.engine.asset.RigBlob;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.foxesworld.rigview.core.Theme.setupTheme;

/**
 * Entry point. Arguments are files to load on start (skeleton JSON, atlas, PNG pages);
 * settings come from {@code -Drigview.*} properties, see {@link ViewerConfig}.
 */
public final class RigViewLauncher {

    private static final Logger log = LogManager.getLogger(RigViewLauncher.class);

    private RigViewLauncher() {}

    public static void main(String[] args) {
        ViewerConfig config = ViewerConfig.fromSystemProperties();
        setupTheme(config.themePath());

        RigViewApplication app = new RigViewApplication(config, filesFromArgs(args));
        app.setSettings(buildSettings(config));
        app.setShowSettings(Boolean.getBoolean("rigview.settingsDialog"));
        app.start();
    }

    static AppSettings buildSettings(ViewerConfig config) {
        AppSettings s = new AppSettings(true);
        s.setTitle(RigViewVersion.NAME + " " + RigViewVersion.VERSION);
        s.setResolution(config.windowWidth(), config.windowHeight());
        s.setResizable(true);
        s.setVSync(true);
        s.setGammaCorrection(false);
        s.setSamples(4);
        return s;
    }

    static List<RigBlob> filesFromArgs(String[] args) {
        List<RigBlob> out = new ArrayList<>();
        if (args == null) return out;
        for (String a : args) {
            if (a == null || a.isBlank()) continue;
            Path p = Path.of(a).toAbsolutePath().normalize();
            if (!Files.isRegularFile(p)) {
                log.warn("Skipping '{}': not a file", a);
                continue;
            }
            out.add(RigBlob.of(p));
        }
        return out;
    }
}
