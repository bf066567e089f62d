package org.foxesworld.rigview.engine.asset.jme;

import com.jme3.asset.AssetKey;
import com.jme3.asset.AssetManager;
import com.jme3.texture.Texture2D;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.asset.AssetKind;
import org.foxesworld.rigview.engine.asset.BlobUrlRegistry;
import org.foxesworld.rigview.engine.asset.PageImages;
import org.foxesworld.rigview.engine.asset.RigAssetManager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * {@link RigAssetManager} on top of the jME {@link AssetManager}.
 *
 * <p>Registrations map a key to a {@code blob:} URI. Loading goes through the jME pipeline
 * ({@link BlobLocator} + {@link SkeletonJsonLoader} / {@link AtlasTextLoader}) on the io
 * executor; atlas pages are decoded through {@link PageTextureCache}. Unloading drops the
 * registration and evicts the jME cache entry.</p>
 */
public final class JmeRigAssetManager implements RigAssetManager {

    private static final Logger log = LogManager.getLogger(JmeRigAssetManager.class);

    private final AssetManager assets;
    private final PageTextureCache textures;
    private final Executor io;
    private final String locatorRoot;

    private final ConcurrentHashMap<String, Registration> entries = new ConcurrentHashMap<>();

    private static final class Registration {
        final String key;
        final String uri;
        final AssetKind kind;
        final PageImages images;
        volatile Object data;

        Registration(String key, String uri, AssetKind kind, PageImages images) {
            this.key = key;
            this.uri = uri;
            this.kind = kind;
            this.images = images;
        }
    }

    public JmeRigAssetManager(AssetManager assets, BlobUrlRegistry blobs, PageTextureCache textures, Executor io) {
        this.assets = Objects.requireNonNull(assets, "assets");
        this.textures = Objects.requireNonNull(textures, "textures");
        this.io = Objects.requireNonNull(io, "io");
        Objects.requireNonNull(blobs, "blobs");

        this.locatorRoot = BlobLocator.bind(blobs);
        assets.registerLocator(locatorRoot, BlobLocator.class);
        assets.registerLoader(SkeletonJsonLoader.class, "json");
        assets.registerLoader(AtlasTextLoader.class, "atlas");
        log.info("Rig asset pipeline registered (locator root={})", locatorRoot);
    }

    @Override
    public void register(String key, String sourceUri, AssetKind kind, PageImages extra) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key is blank");
        if (sourceUri == null || sourceUri.isBlank()) throw new IllegalArgumentException("sourceUri is blank");
        Objects.requireNonNull(kind, "kind");
        if (kind == AssetKind.ATLAS && extra == null) {
            throw new IllegalArgumentException("atlas registration needs page images: " + key);
        }
        Registration prev = entries.putIfAbsent(key, new Registration(key, sourceUri, kind, extra));
        if (prev != null) throw new IllegalStateException("Asset key already registered: " + key);
    }

    @Override
    public CompletableFuture<Void> load(List<String> keys) {
        List<Registration> batch = new ArrayList<>(keys.size());
        for (String key : keys) {
            Registration r = entries.get(key);
            if (r == null) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown asset key: " + key));
            }
            batch.add(r);
        }
        return CompletableFuture.runAsync(() -> batch.forEach(this::loadOne), io);
    }

    private void loadOne(Registration r) {
        if (r.data != null) return;
        switch (r.kind) {
            case SKELETON -> r.data = assets.loadAsset(new AssetKey<SkeletonData>(r.uri));
            case ATLAS -> {
                AtlasPages pages = assets.loadAsset(new AssetKey<AtlasPages>(r.uri));
                r.data = new LoadedAtlas(pages, bindPages(pages, r.images));
            }
        }
        log.debug("Loaded {} key={}", r.kind, r.key);
    }

    private Map<String, Texture2D> bindPages(AtlasPages pages, PageImages images) {
        Map<String, Texture2D> out = new LinkedHashMap<>();
        if (images instanceof PageImages.Single single) {
            if (!pages.pageNames().isEmpty()) out.put(pages.pageNames().get(0), textures.get(single.image()));
        } else if (images instanceof PageImages.Named named) {
            named.byPage().forEach((page, blob) -> out.put(page, textures.get(blob)));
        }
        return out;
    }

    @Override
    public CompletableFuture<Void> unload(List<String> keys) {
        for (String key : keys) {
            Registration r = entries.remove(key);
            if (r == null) continue;
            assets.deleteFromCache(new AssetKey<>(r.uri));
            r.data = null;
            log.debug("Unloaded {} key={}", r.kind, key);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isRegistered(String key) {
        return key != null && entries.containsKey(key);
    }

    @Override
    public int registeredCount() {
        return entries.size();
    }

    public SkeletonData skeleton(String key) {
        return loaded(key, SkeletonData.class);
    }

    public LoadedAtlas atlas(String key) {
        return loaded(key, LoadedAtlas.class);
    }

    private <T> T loaded(String key, Class<T> type) {
        Registration r = entries.get(key);
        Object data = r == null ? null : r.data;
        if (!type.isInstance(data)) {
            throw new IllegalStateException(type.getSimpleName() + " not loaded: " + key);
        }
        return type.cast(data);
    }

    /** Drops every registration and detaches the blob locator. */
    public void shutdown() {
        unload(new ArrayList<>(entries.keySet()));
        assets.unregisterLocator(locatorRoot, BlobLocator.class);
        BlobLocator.unbind(locatorRoot);
        textures.invalidateAll();
        log.info("Rig asset pipeline shut down");
    }
}
