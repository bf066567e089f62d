package org.foxesworld.rigview.engine.stage.jme;

import com.jme3.asset.AssetManager;
import org.foxesworld.rigview.engine.stage.Overlay;
import org.foxesworld.rigview.engine.stage.OverlayFactory;

import java.util.Objects;

public final class JmeOverlayFactory implements OverlayFactory {

    private final AssetManager assets;

    public JmeOverlayFactory(AssetManager assets) {
        this.assets = Objects.requireNonNull(assets, "assets");
    }

    @Override
    public Overlay create(String name, int layer) {
        return new JmeOverlay(assets, name, layer);
    }
}
