package org.foxesworld.rigview.engine.testsupport;

import org.foxesworld.rigview.engine.asset.AssetKind;
import org.foxesworld.rigview.engine.asset.PageImages;
import org.foxesworld.rigview.engine.asset.RigAssetManager;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Registry kept in a map; loads complete immediately unless told to fail. */
public final class InMemoryAssetManager implements RigAssetManager {

    public record Registration(String key, String uri, AssetKind kind, PageImages images) {}

    private final Map<String, Registration> entries = new LinkedHashMap<>();
    private final List<String> unloaded = new ArrayList<>();
    private final List<Registration> history = new ArrayList<>();
    private boolean failLoads;
    private boolean failRegister;

    @Override
    public synchronized void register(String key, String sourceUri, AssetKind kind, PageImages extra) {
        if (failRegister) throw new IllegalArgumentException("registration rejected: " + key);
        if (entries.containsKey(key)) throw new IllegalStateException("Asset key already registered: " + key);
        Registration r = new Registration(key, sourceUri, kind, extra);
        entries.put(key, r);
        history.add(r);
    }

    @Override
    public synchronized CompletableFuture<Void> load(List<String> keys) {
        if (failLoads) return CompletableFuture.failedFuture(new IOException("decode failed"));
        for (String k : keys) {
            if (!entries.containsKey(k)) return CompletableFuture.failedFuture(new IllegalStateException("unknown " + k));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> unload(List<String> keys) {
        for (String k : keys) {
            if (entries.remove(k) != null) unloaded.add(k);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized boolean isRegistered(String key) {
        return entries.containsKey(key);
    }

    @Override
    public synchronized int registeredCount() {
        return entries.size();
    }

    public synchronized List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    public synchronized Registration registration(String key) {
        return entries.get(key);
    }

    /** Every registration ever made, including released ones. */
    public synchronized List<Registration> history() {
        return List.copyOf(history);
    }

    public synchronized List<String> unloaded() {
        return List.copyOf(unloaded);
    }

    public synchronized void failLoads(boolean fail) {
        this.failLoads = fail;
    }

    public synchronized void failRegister(boolean fail) {
        this.failRegister = fail;
    }
}
