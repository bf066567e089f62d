package org.foxesworld.rigview.engine.asset;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Process-wide registry the binder registers skeleton and atlas sources into.
 * Transient URIs passed to {@link #register} stay owned by the caller and are never revoked here.
 */
public interface RigAssetManager {

    /**
     * @param extra page images for {@link AssetKind#ATLAS}; null for other kinds
     * @throws IllegalStateException when the key is already registered
     */
    void register(String key, String sourceUri, AssetKind kind, PageImages extra);

    /** Loads every key; completes exceptionally when any of them fails. */
    CompletableFuture<Void> load(List<String> keys);

    /** Drops registrations and loaded data. Unknown keys are ignored. */
    CompletableFuture<Void> unload(List<String> keys);

    boolean isRegistered(String key);

    int registeredCount();
}
