package org.foxesworld.rigview.engine.lifecycle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.asset.BoundRig;
import org.foxesworld.rigview.engine.asset.RigBindException;
import org.foxesworld.rigview.engine.asset.RigBinder;
import org.foxesworld.rigview.engine.asset.RigDescriptor;
import org.foxesworld.rigview.engine.rig.RigInstance;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.slot.SlotRegistry;
import org.foxesworld.rigview.engine.slot.SlotState;
import org.foxesworld.rigview.engine.stage.Overlay;
import org.foxesworld.rigview.engine.stage.OverlayFactory;
import org.foxesworld.rigview.engine.stage.RenderStage;
import org.foxesworld.rigview.engine.stage.StageSynchronizer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Owns load, retire and install for every slot.
 *
 * <p>Each load takes a fresh slot generation. When the bind completes the result is applied only
 * if that generation is still the slot's current one; otherwise the rig is destroyed and its
 * bundle released without touching the slot. Completions are handed to {@code renderThread},
 * so every arena and slot mutation happens there.</p>
 *
 * <p>Public methods are render-thread only.</p>
 */
public final class RigLifecycleCoordinator {

    private static final Logger log = LogManager.getLogger(RigLifecycleCoordinator.class);

    public static final String DEFAULT_FAILURE = "Failed to load spine data.";

    private final SlotRegistry slots;
    private final RigArena arena;
    private final RigBinder binder;
    private final RenderStage stage;
    private final OverlayFactory overlays;
    private final StageSynchronizer synchronizer;
    private final Executor renderThread;

    private volatile boolean closed;

    public RigLifecycleCoordinator(SlotRegistry slots,
                                   RigArena arena,
                                   RigBinder binder,
                                   RenderStage stage,
                                   OverlayFactory overlays,
                                   StageSynchronizer synchronizer,
                                   Executor renderThread) {
        this.slots = Objects.requireNonNull(slots, "slots");
        this.arena = Objects.requireNonNull(arena, "arena");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.overlays = Objects.requireNonNull(overlays, "overlays");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
        this.renderThread = Objects.requireNonNull(renderThread, "renderThread");
    }

    public SlotRegistry slots() { return slots; }
    public RigArena arena() { return arena; }

    // -------------------- load --------------------

    /** Loads with the slot's current scale. */
    public CompletableFuture<LoadOutcome> load(SlotId id, RigDescriptor descriptor) {
        return load(id, descriptor, null);
    }

    /**
     * Starts a load into {@code id}. The slot goes to LOADING right away; whatever it held stays
     * attached until this load (or a newer one) completes.
     *
     * @param scaleOverride scale to install with; null keeps the slot's scale
     * @return never fails; tells how the request ended
     */
    public CompletableFuture<LoadOutcome> load(SlotId id, RigDescriptor descriptor, Float scaleOverride) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(descriptor, "descriptor");
        if (closed) return CompletableFuture.completedFuture(LoadOutcome.SUPERSEDED);

        float scale = scaleOverride != null ? scaleOverride : slots.get(id).scale();
        long generation = slots.beginLoad(id);
        log.debug("Load started slot={} gen={} skeleton={}", id, generation, descriptor.skeleton().name());

        if (!stage.isReady()) {
            return CompletableFuture.completedFuture(
                    fail(id, generation, RigBindException.rendererUnavailable()));
        }

        CompletableFuture<BoundRig> binding;
        try {
            binding = binder.bind(descriptor, id.key());
        } catch (RuntimeException e) {
            binding = CompletableFuture.failedFuture(e);
        }
        return binding.handleAsync((rig, err) -> complete(id, generation, scale, rig, err), renderThread);
    }

    /**
     * Loads {@code descriptor} into every grid slot that is EMPTY or FAILED right now, one after
     * another, each at {@code scale}. A failing slot does not stop the rest.
     *
     * @return number of load attempts made
     */
    public CompletableFuture<Integer> fillEmpty(RigDescriptor descriptor, float scale) {
        Objects.requireNonNull(descriptor, "descriptor");
        List<SlotId> targets = slots.empty().stream().map(SlotState::id).toList();
        log.info("Filling {} empty grid slot(s)", targets.size());

        CompletableFuture<Integer> chain = CompletableFuture.completedFuture(0);
        for (SlotId id : targets) {
            chain = chain.thenCompose(n -> {
                if (closed) return CompletableFuture.completedFuture(n);
                slots.update(id, s -> s.withScale(scale));
                return load(id, descriptor, scale).thenApply(outcome -> n + 1);
            });
        }
        return chain;
    }

    private LoadOutcome complete(SlotId id, long generation, float scale, BoundRig rig, Throwable err) {
        if (closed || !slots.isCurrent(id, generation)) {
            if (rig != null) rig.discard(binder.assets(), binder.blobs());
            log.debug("Load superseded slot={} gen={}", id, generation);
            return LoadOutcome.SUPERSEDED;
        }
        if (err != null) {
            return fail(id, generation, RigBinder.unwrap(err));
        }
        try {
            retire(id);
            install(id, rig, scale);
        } catch (RuntimeException e) {
            log.warn("Install failed slot={}", id, e);
            retire(id);
            rig.discard(binder.assets(), binder.blobs());
            slots.update(id, s -> s.failed(failureMessage(e)));
            synchronizer.sync();
            return LoadOutcome.FAILED;
        }
        synchronizer.sync();
        log.info("Rig installed slot={} gen={} animations={} skins={}",
                id, generation, rig.animations().size(), rig.skins().size());
        return LoadOutcome.APPLIED;
    }

    private LoadOutcome fail(SlotId id, long generation, Throwable cause) {
        String message = failureMessage(cause);
        log.warn("Load failed slot={} gen={}: {}", id, generation, message);
        retire(id);
        slots.update(id, s -> s.failed(message));
        synchronizer.sync();
        return LoadOutcome.FAILED;
    }

    private void install(SlotId id, BoundRig rig, float scale) {
        RigInstance instance = rig.instance();
        SlotState current = slots.get(id);

        instance.setScale(scale);
        String skin = first(rig.skins());
        if (!skin.isEmpty()) instance.setSkin(skin);
        String animation = first(rig.animations());
        if (!animation.isEmpty()) instance.setAnimation(animation, current.looping());
        instance.setTimeScale(current.playing() ? 1f : 0f);

        arena.put(id, instance, rig.bundle());
        if (id.isSingle() || synchronizer.outlinesVisible()) {
            arena.putOutline(id, overlays.create("outline:" + id.key(), OverlayFactory.LAYER_OUTLINE));
        }
        slots.update(id, s -> s.bound(rig.animations(), animation, rig.skins(), skin, scale));
    }

    /** Destroys the slot's instance, releases its bundle and drops its outline. */
    private void retire(SlotId id) {
        RigArena.Entry entry = arena.remove(id);
        if (entry != null) {
            entry.instance().destroy();
            entry.bundle().release(binder.assets(), binder.blobs());
            log.debug("Retired slot={} keys={}", id, entry.bundle().keys());
        }
        Overlay outline = arena.removeOutline(id);
        if (outline != null) outline.destroy();
    }

    // -------------------- clear --------------------

    /** Retires the slot and resets it to empty. A load still in flight for it is discarded. */
    public void clear(SlotId id) {
        Objects.requireNonNull(id, "id");
        boolean inFlight = slots.get(id).isLoading();
        retire(id);
        if (inFlight) slots.nextGeneration(id);
        slots.reset(id);
        synchronizer.sync();
    }

    /** Clears every grid slot that holds a rig or has a load in flight. */
    public int clearAll() {
        int n = 0;
        for (SlotState s : slots.grid()) {
            if (s.hasRig() || s.isLoading() || arena.isOccupied(s.id())) {
                clear(s.id());
                n++;
            }
        }
        log.info("Cleared {} grid slot(s)", n);
        return n;
    }

    // -------------------- controls --------------------

    public void selectAnimation(SlotId id, String name) {
        String value = name == null ? "" : name;
        SlotState s = slots.update(id, prev -> prev.withSelectedAnimation(value));
        RigInstance rig = arena.instance(id);
        if (rig != null && !value.isEmpty()) rig.setAnimation(value, s.looping());
    }

    public void selectSkin(SlotId id, String name) {
        String value = name == null ? "" : name;
        slots.update(id, prev -> prev.withSelectedSkin(value));
        RigInstance rig = arena.instance(id);
        if (rig != null && !value.isEmpty()) {
            rig.setSkin(value);
            synchronizer.reposition(id);
        }
    }

    public void setLooping(SlotId id, boolean looping) {
        SlotState s = slots.update(id, prev -> prev.withLooping(looping));
        RigInstance rig = arena.instance(id);
        if (rig != null && !s.selectedAnimation().isEmpty()) rig.setAnimation(s.selectedAnimation(), looping);
    }

    public void setPlaying(SlotId id, boolean playing) {
        slots.update(id, prev -> prev.withPlaying(playing));
        RigInstance rig = arena.instance(id);
        if (rig != null) rig.setTimeScale(playing ? 1f : 0f);
    }

    public void setScale(SlotId id, float scale) {
        requireScale(scale);
        slots.update(id, prev -> prev.withScale(scale));
        RigInstance rig = arena.instance(id);
        if (rig != null) {
            rig.setScale(scale);
            synchronizer.reposition(id);
        }
    }

    /** Applies {@code scale} to every grid slot record and every grid instance. */
    public void setScaleAll(float scale) {
        requireScale(scale);
        for (SlotId id : slots.gridIds()) {
            slots.update(id, prev -> prev.withScale(scale));
        }
        arena.gridInstances().values().forEach(rig -> rig.setScale(scale));
        synchronizer.relayout();
    }

    /** Creates the outline of every bound grid slot that has none. */
    public int ensureOutlines() {
        int created = 0;
        for (SlotId id : arena.gridInstances().keySet()) {
            if (arena.outline(id) == null) {
                arena.putOutline(id, overlays.create("outline:" + id.key(), OverlayFactory.LAYER_OUTLINE));
                created++;
            }
        }
        return created;
    }

    /** Creates missing grid outlines before showing them; hiding keeps them for later. */
    public void setOutlinesVisible(boolean visible) {
        if (visible) ensureOutlines();
        synchronizer.setOutlinesVisible(visible);
    }

    // -------------------- shutdown --------------------

    /** Retires every slot. Completions arriving later are discarded. */
    public void shutdown() {
        if (closed) return;
        closed = true;
        for (SlotId id : arena.occupied()) retire(id);
        for (SlotState s : slots.all()) {
            Overlay outline = arena.removeOutline(s.id());
            if (outline != null) outline.destroy();
        }
        log.info("Lifecycle coordinator shut down");
    }

    public boolean isClosed() {
        return closed;
    }

    // -------------------- util --------------------

    static String failureMessage(Throwable t) {
        Throwable cause = t == null ? null : RigBinder.unwrap(t);
        String msg = cause == null ? null : cause.getMessage();
        return (msg == null || msg.isBlank()) ? DEFAULT_FAILURE : msg;
    }

    private static String first(List<String> names) {
        return names.isEmpty() ? "" : names.get(0);
    }

    private static void requireScale(float scale) {
        if (!(scale > 0f) || Float.isInfinite(scale)) {
            throw new IllegalArgumentException("scale must be positive: " + scale);
        }
    }
}
