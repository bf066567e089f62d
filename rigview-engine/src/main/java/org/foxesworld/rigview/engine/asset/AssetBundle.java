package org.foxesworld.rigview.engine.asset;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration keys and transient URIs created while binding one rig.
 * {@link #release} runs at most once no matter how many owners call it.
 */
public final class AssetBundle {

    private static final Logger log = LogManager.getLogger(AssetBundle.class);

    private final List<String> keys;
    private final List<String> urls;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public AssetBundle(List<String> keys, List<String> urls) {
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
        this.urls = List.copyOf(Objects.requireNonNull(urls, "urls"));
    }

    public List<String> keys() { return keys; }
    public List<String> urls() { return urls; }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Unloads the keys, then revokes the URIs even if the unload failed.
     * The returned future never completes exceptionally.
     */
    public CompletableFuture<Void> release(RigAssetManager assets, BlobUrlRegistry blobs) {
        Objects.requireNonNull(assets, "assets");
        Objects.requireNonNull(blobs, "blobs");
        if (!released.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> unloading;
        try {
            unloading = assets.unload(keys);
        } catch (RuntimeException e) {
            unloading = CompletableFuture.failedFuture(e);
        }

        return unloading.handle((ignored, err) -> {
            if (err != null) log.warn("Bundle unload failed keys={}", keys, err);
            for (String url : urls) blobs.revoke(url);
            log.debug("Bundle released keys={}", keys);
            return null;
        });
    }

    @Override
    public String toString() {
        return "AssetBundle" + keys + (released.get() ? " (released)" : "");
    }
}
