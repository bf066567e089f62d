package org.foxesworld.rigview.engine.asset.jme;

import com.jme3.texture.Texture2D;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Atlas descriptor with a texture bound to every page. */
public record LoadedAtlas(AtlasPages pages, Map<String, Texture2D> textures) {

    public LoadedAtlas {
        textures = Collections.unmodifiableMap(new LinkedHashMap<>(textures));
    }

    public Texture2D page(String name) {
        return textures.get(name);
    }

    /** Texture of the first declared page, or null. */
    public Texture2D firstPage() {
        return pages.pageNames().isEmpty() ? null : textures.get(pages.pageNames().get(0));
    }
}
