package org.foxesworld.rigview.engine.asset;

public enum AssetKind {
    SKELETON,
    ATLAS
}
