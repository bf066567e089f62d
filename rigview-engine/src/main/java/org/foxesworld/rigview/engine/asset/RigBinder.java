package org.foxesworld.rigview.engine.asset;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.atlas.AtlasPageParser;
import org.foxesworld.rigview.engine.rig.RigInstance;
import org.foxesworld.rigview.engine.rig.RigRuntime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binds raw rig files into a live {@link RigInstance}.
 *
 * <p>Pipeline: read atlas (io executor) → page names → image matching → transient URIs →
 * register skeleton + atlas → load → instantiate. Every failure after the URIs exist
 * unwinds the registrations and revokes the URIs before the returned future fails, so no
 * partial registration outlives a failed bind.</p>
 *
 * <p>The result may be abandoned by the caller; it then owns the release through
 * {@link BoundRig#discard}.</p>
 */
public final class RigBinder {

    private static final Logger log = LogManager.getLogger(RigBinder.class);

    private static final AtomicLong IDS = new AtomicLong(1);

    public static final String SKELETON_KEY_PREFIX = "rig-skeleton-";
    public static final String ATLAS_KEY_PREFIX = "rig-atlas-";

    private final RigAssetManager assets;
    private final BlobUrlRegistry blobs;
    private final RigRuntime runtime;
    private final Executor io;

    public RigBinder(RigAssetManager assets, BlobUrlRegistry blobs, RigRuntime runtime, Executor io) {
        this.assets = Objects.requireNonNull(assets, "assets");
        this.blobs = Objects.requireNonNull(blobs, "blobs");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.io = Objects.requireNonNull(io, "io");
    }

    public RigAssetManager assets() { return assets; }
    public BlobUrlRegistry blobs() { return blobs; }

    /**
     * @param prefix caller correlation id (slot key); becomes part of the registration keys
     * @return future failing with {@link RigBindException} (possibly wrapped in a {@link CompletionException})
     */
    public CompletableFuture<BoundRig> bind(RigDescriptor descriptor, String prefix) {
        Objects.requireNonNull(descriptor, "descriptor");
        final String p = (prefix == null || prefix.isBlank()) ? "rig" : prefix.trim();

        return CompletableFuture
                .supplyAsync(() -> matchPages(descriptor), io)
                .thenCompose(images -> registerAndLoad(descriptor, images, p));
    }

    // -------------------- page matching --------------------

    private PageImages matchPages(RigDescriptor d) {
        String atlasText;
        try {
            atlasText = new String(d.atlas().read(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw RigBindException.registrationFailure("cannot read " + d.atlas().name(), e);
        }
        List<String> pages = AtlasPageParser.parsePageNames(atlasText);
        return matchImages(pages, d.images());
    }

    /**
     * One page and one image bind directly. Otherwise each page needs an image whose name equals
     * the page name, or whose name without extension does.
     */
    static PageImages matchImages(List<String> pages, List<RigBlob> images) {
        if (pages.size() == 1 && images.size() == 1) {
            return PageImages.single(images.get(0));
        }

        Map<String, RigBlob> exact = new HashMap<>();
        Map<String, RigBlob> byStem = new HashMap<>();
        for (RigBlob img : images) {
            exact.putIfAbsent(img.name(), img);
            byStem.putIfAbsent(img.stem(), img);
        }

        Map<String, RigBlob> matched = new LinkedHashMap<>();
        Set<String> missing = new LinkedHashSet<>();
        for (String page : pages) {
            RigBlob img = exact.get(page);
            if (img == null) img = byStem.get(page);
            if (img == null) {
                missing.add(page);
            } else {
                matched.putIfAbsent(page, img);
            }
        }
        if (!missing.isEmpty()) {
            throw RigBindException.missingPages(new ArrayList<>(missing));
        }
        return PageImages.named(matched);
    }

    // -------------------- registration --------------------

    private CompletableFuture<BoundRig> registerAndLoad(RigDescriptor d, PageImages images, String prefix) {
        String assetId = prefix + "-" + System.currentTimeMillis() + "-"
                + Long.toHexString(IDS.getAndIncrement())
                + Long.toHexString(ThreadLocalRandom.current().nextLong() & 0xffffffffL);
        String skeletonKey = SKELETON_KEY_PREFIX + assetId;
        String atlasKey = ATLAS_KEY_PREFIX + assetId;

        String skeletonUrl = blobs.create(d.skeleton());
        String atlasUrl = blobs.create(d.atlas());
        AssetBundle bundle = new AssetBundle(List.of(skeletonKey, atlasKey), List.of(skeletonUrl, atlasUrl));

        CompletableFuture<BoundRig> out = new CompletableFuture<>();
        CompletableFuture<Void> loading;
        try {
            assets.register(skeletonKey, skeletonUrl, AssetKind.SKELETON, null);
            assets.register(atlasKey, atlasUrl, AssetKind.ATLAS, images);
            loading = assets.load(bundle.keys());
        } catch (RuntimeException e) {
            unwind(bundle, RigBindException.registrationFailure(describe(e), e), out);
            return out;
        }

        loading.whenComplete((ignored, err) -> {
            if (err != null) {
                Throwable cause = unwrap(err);
                unwind(bundle, RigBindException.registrationFailure(describe(cause), cause), out);
                return;
            }
            BoundRig rig;
            try {
                rig = instantiate(skeletonKey, atlasKey, bundle);
            } catch (RuntimeException e) {
                unwind(bundle, RigBindException.instantiationFailure(describe(e), e), out);
                return;
            }
            log.debug("Bound rig prefix={} keys={} pages={}", prefix, bundle.keys(), images.count());
            out.complete(rig);
        });
        return out;
    }

    private BoundRig instantiate(String skeletonKey, String atlasKey, AssetBundle bundle) {
        RigInstance rig = runtime.instantiate(skeletonKey, atlasKey);
        if (rig == null) throw new IllegalStateException("runtime returned no rig");
        try {
            return new BoundRig(rig, bundle, rig.animationNames(), rig.skinNames());
        } catch (RuntimeException e) {
            rig.destroy();
            throw e;
        }
    }

    private void unwind(AssetBundle bundle, RigBindException error, CompletableFuture<BoundRig> out) {
        log.debug("Bind failed, unwinding keys={}: {}", bundle.keys(), error.getMessage());
        bundle.release(assets, blobs).whenComplete((v, e) -> out.completeExceptionally(error));
    }

    // -------------------- util --------------------

    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof java.util.concurrent.ExecutionException)
                && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
