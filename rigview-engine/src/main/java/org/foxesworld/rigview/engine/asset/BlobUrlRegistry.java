package org.foxesworld.rigview.engine.asset;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transient {@code blob:} URIs pointing at in-memory blobs. Whoever creates a URI revokes it.
 * The file name stays at the end of the URI so extension-based loaders can pick it up.
 */
public final class BlobUrlRegistry {

    private static final Logger log = LogManager.getLogger(BlobUrlRegistry.class);

    public static final String SCHEME = "blob:";
    private static final String ROOT = SCHEME + "rigview/";

    private final AtomicLong ids = new AtomicLong(1);
    private final ConcurrentHashMap<String, RigBlob> byUri = new ConcurrentHashMap<>();

    public String create(RigBlob blob) {
        Objects.requireNonNull(blob, "blob");
        String uri = ROOT + ids.getAndIncrement() + "-" + Long.toHexString(ThreadLocalRandom.current().nextLong())
                + "/" + URLEncoder.encode(blob.name(), StandardCharsets.UTF_8);
        byUri.put(uri, blob);
        if (log.isDebugEnabled()) log.debug("blob url created {} ({} bytes)", uri, blob.size());
        return uri;
    }

    /** @return the blob, or null when the URI is unknown or revoked */
    public RigBlob resolve(String uri) {
        return uri == null ? null : byUri.get(uri);
    }

    /** @return true when the URI was live */
    public boolean revoke(String uri) {
        if (uri == null) return false;
        boolean removed = byUri.remove(uri) != null;
        if (removed && log.isDebugEnabled()) log.debug("blob url revoked {}", uri);
        return removed;
    }

    public boolean isLive(String uri) {
        return uri != null && byUri.containsKey(uri);
    }

    public int outstanding() {
        return byUri.size();
    }

    public static boolean isBlobUri(String s) {
        return s != null && s.startsWith(SCHEME);
    }
}
