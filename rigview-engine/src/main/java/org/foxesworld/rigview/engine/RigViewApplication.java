package org.foxesworld.rigview.engine;

import com.jme3.app.SimpleApplication;
import com.jme3.app.state.AppState;
import com.jme3.math.ColorRGBA;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.core.RigViewPlatform;
import org.foxesworld.rigview.core.RigViewVersion;
import org.foxesworld.rigview.engine.app.RigViewAppState;
import org.foxesworld.rigview.engine.app.ViewerConfig;
import org.foxesworld.rigview.engine.asset.RigBlob;

import java.util.List;
import java.util.Objects;

public class RigViewApplication extends SimpleApplication {

    private static final Logger log = LogManager.getLogger(RigViewApplication.class);

    private static final ColorRGBA BACKGROUND = new ColorRGBA(0.08f, 0.07f, 0.1f, 1f);

    private final ViewerConfig config;
    private final List<RigBlob> initialFiles;

    public RigViewApplication(ViewerConfig config, List<RigBlob> initialFiles) {
        // no fly cam, stats or debug keys
        super((AppState[]) null);
        this.config = Objects.requireNonNull(config, "config");
        this.initialFiles = initialFiles == null ? List.of() : List.copyOf(initialFiles);
    }

    @Override
    public void simpleInitApp() {
        log.info("{} {}", RigViewVersion.NAME, RigViewVersion.VERSION);
        log.info("Java: {}", RigViewPlatform.java());
        log.info("OS: {}", RigViewPlatform.os());

        inputManager.setCursorVisible(true);
        viewPort.setBackgroundColor(BACKGROUND);

        stateManager.attach(new RigViewAppState(config, initialFiles));
    }

    @Override
    public void handleError(String errMsg, Throwable t) {
        log.error("Fatal: {}", errMsg, t);
        stop();
    }
}
