package org.foxesworld.rigview.engine.asset.jme;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetKey;
import com.jme3.asset.AssetLoadException;
import com.jme3.asset.AssetLocator;
import com.jme3.asset.AssetManager;
import org.foxesworld.rigview.engine.asset.BlobUrlRegistry;
import org.foxesworld.rigview.engine.asset.RigBlob;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves {@code blob:} asset names against a {@link BlobUrlRegistry}.
 *
 * <p>jME instantiates locators reflectively, so the registry is handed over through the root
 * path: {@link #bind} returns a root token to pass to {@code registerLocator}.</p>
 */
public final class BlobLocator implements AssetLocator {

    private static final ConcurrentHashMap<String, BlobUrlRegistry> ROOTS = new ConcurrentHashMap<>();
    private static final AtomicInteger SEQ = new AtomicInteger();

    private BlobUrlRegistry registry;

    public static String bind(BlobUrlRegistry registry) {
        if (registry == null) throw new IllegalArgumentException("registry is null");
        String root = "rigview-blobs-" + SEQ.incrementAndGet();
        ROOTS.put(root, registry);
        return root;
    }

    public static void unbind(String root) {
        if (root != null) ROOTS.remove(root);
    }

    @Override
    public void setRootPath(String rootPath) {
        BlobUrlRegistry r = ROOTS.get(rootPath);
        if (r == null) throw new IllegalArgumentException("No blob registry bound to root: " + rootPath);
        this.registry = r;
    }

    @Override
    public AssetInfo locate(AssetManager manager, AssetKey key) {
        String name = key.getName();
        if (registry == null || !BlobUrlRegistry.isBlobUri(name)) return null;
        RigBlob blob = registry.resolve(name);
        if (blob == null) return null;
        return new BlobAssetInfo(manager, key, blob);
    }

    private static final class BlobAssetInfo extends AssetInfo {

        private final RigBlob blob;

        BlobAssetInfo(AssetManager manager, AssetKey key, RigBlob blob) {
            super(manager, key);
            this.blob = blob;
        }

        @Override
        public InputStream openStream() {
            try {
                return new ByteArrayInputStream(blob.read());
            } catch (IOException e) {
                throw new AssetLoadException("Failed to read blob " + blob.name(), e);
            }
        }
    }
}
