package org.foxesworld.rigview.engine.asset;

import org.foxesworld.rigview.engine.rig.RigInstance;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Successful bind: the live rig, the bundle that backs it, and its declared names. */
public record BoundRig(RigInstance instance, AssetBundle bundle, List<String> animations, List<String> skins) {

    public BoundRig {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(bundle, "bundle");
        animations = List.copyOf(animations);
        skins = List.copyOf(skins);
    }

    /** Drops a result that will never be attached. */
    public CompletableFuture<Void> discard(RigAssetManager assets, BlobUrlRegistry blobs) {
        instance.destroy();
        return bundle.release(assets, blobs);
    }
}
