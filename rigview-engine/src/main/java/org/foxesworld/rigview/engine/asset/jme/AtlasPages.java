package org.foxesworld.rigview.engine.asset.jme;

import java.util.List;

/** Loaded atlas descriptor: page names in order of appearance plus the raw text. */
public record AtlasPages(List<String> pageNames, String text) {

    public AtlasPages {
        pageNames = List.copyOf(pageNames);
        text = text == null ? "" : text;
    }
}
