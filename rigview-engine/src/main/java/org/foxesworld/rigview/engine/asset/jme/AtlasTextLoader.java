package org.foxesworld.rigview.engine.asset.jme;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetLoader;
import org.foxesworld.rigview.engine.atlas.AtlasPageParser;

import java.io.IOException;

/** Loads {@code .atlas} assets as {@link AtlasPages}. */
public final class AtlasTextLoader implements AssetLoader {

    @Override
    public Object load(AssetInfo assetInfo) throws IOException {
        String text = AssetIO.readTextUtf8(assetInfo);
        return new AtlasPages(AtlasPageParser.extractPageNames(text), text);
    }
}
