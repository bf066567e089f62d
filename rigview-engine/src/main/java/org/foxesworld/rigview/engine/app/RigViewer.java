package org.foxesworld.rigview.engine.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.asset.RigBinder;
import org.foxesworld.rigview.engine.asset.RigBlob;
import org.foxesworld.rigview.engine.asset.RigDescriptor;
import org.foxesworld.rigview.engine.asset.RigFileSelection;
import org.foxesworld.rigview.engine.lifecycle.LoadOutcome;
import org.foxesworld.rigview.engine.lifecycle.RigArena;
import org.foxesworld.rigview.engine.lifecycle.RigLifecycleCoordinator;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.slot.SlotPhase;
import org.foxesworld.rigview.engine.slot.SlotRegistry;
import org.foxesworld.rigview.engine.slot.SlotState;
import org.foxesworld.rigview.engine.stage.OverlayFactory;
import org.foxesworld.rigview.engine.stage.PresentationMode;
import org.foxesworld.rigview.engine.stage.RenderStage;
import org.foxesworld.rigview.engine.stage.StageSynchronizer;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * User-level operations of the viewer: the picked files per mode, the active grid slot, the
 * scale policy and the auto-load trigger. Holds no widgets; the app state and the input
 * listener drive it. Render-thread only.
 */
public final class RigViewer {

    private static final Logger log = LogManager.getLogger(RigViewer.class);

    public static final float MIN_SCALE = 0.1f;
    public static final float MAX_SCALE = 5f;
    public static final int MIN_CELL_SIZE = 40;
    public static final int MAX_CELL_SIZE = 400;

    public static final String STATUS_IDLE = "Drop files to get started.";
    public static final String STATUS_READY = "Spine loaded. Ready to animate.";

    private final RigLifecycleCoordinator coordinator;
    private final StageSynchronizer synchronizer;
    private final SlotRegistry slots;

    private SlotId activeSlot = SlotId.grid(0, 0);
    private float gridScale;
    private boolean scaleAll = true;

    private RigFileSelection singleFiles = RigFileSelection.EMPTY;
    private RigFileSelection gridFiles = RigFileSelection.EMPTY;
    private String lastSingleSignature = "";
    private String lastGridSignature = "";
    private int inFlight;

    public RigViewer(RigLifecycleCoordinator coordinator, StageSynchronizer synchronizer, float initialScale) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
        this.slots = coordinator.slots();
        float s = clampScale(initialScale);
        this.gridScale = s;
        slots.update(SlotId.SINGLE, st -> st.withScale(s));
        for (SlotId id : slots.gridIds()) slots.update(id, st -> st.withScale(s));
    }

    /** Wires the full core around the given seams. */
    public static RigViewer create(ViewerConfig config, RenderStage stage, OverlayFactory overlays,
                                   RigBinder binder, Executor renderThread) {
        SlotRegistry slots = new SlotRegistry();
        RigArena arena = new RigArena();
        StageSynchronizer synchronizer = new StageSynchronizer(stage, overlays, arena,
                config.cellSize(), config.cellGap(), config.cellRadius(), config.outlines());
        RigLifecycleCoordinator coordinator = new RigLifecycleCoordinator(slots, arena, binder, stage,
                overlays, synchronizer, renderThread);
        return new RigViewer(coordinator, synchronizer, config.scale());
    }

    public RigLifecycleCoordinator coordinator() { return coordinator; }
    public StageSynchronizer synchronizer() { return synchronizer; }
    public SlotRegistry slots() { return slots; }

    public PresentationMode mode() { return synchronizer.mode(); }
    public SlotId activeSlot() { return activeSlot; }
    public boolean isScaleAll() { return scaleAll; }
    public float gridScale() { return gridScale; }
    public boolean isBusy() { return inFlight > 0; }

    /** Slot the controls act on: the single slot in SINGLE mode, else the active grid slot. */
    public SlotId target() {
        return mode() == PresentationMode.SINGLE ? SlotId.SINGLE : activeSlot;
    }

    public SlotState targetState() {
        return slots.get(target());
    }

    public RigFileSelection files() {
        return mode() == PresentationMode.SINGLE ? singleFiles : gridFiles;
    }

    public String status() {
        SlotState s = targetState();
        if (mode() == PresentationMode.SINGLE) {
            if (s.phase() == SlotPhase.BOUND) return STATUS_READY;
            if (s.phase() == SlotPhase.EMPTY && s.generation() == 0L) return STATUS_IDLE;
        }
        return s.status();
    }

    // -------------------- files --------------------

    /** Replaces the picked files of the current mode and auto-loads them when complete. */
    public RigFileSelection selectFiles(Collection<? extends RigBlob> blobs) {
        RigFileSelection sel = RigFileSelection.classify(blobs);
        if (mode() == PresentationMode.SINGLE) {
            singleFiles = sel;
        } else {
            gridFiles = sel;
        }
        log.debug("Selected {} for {}", sel.describe(), mode());
        offer();
        return sel;
    }

    /**
     * Auto-load trigger: loads the current mode's files unless a load is running or the same
     * files (and, in GRID mode, the same slot) were loaded last time.
     */
    public Optional<CompletableFuture<LoadOutcome>> offer() {
        if (inFlight > 0) return Optional.empty();
        if (mode() == PresentationMode.SINGLE) {
            if (!singleFiles.isComplete()) return Optional.empty();
            String sig = singleFiles.signature();
            if (sig.equals(lastSingleSignature)) return Optional.empty();
            lastSingleSignature = sig;
            return Optional.of(loadSingle());
        }
        if (!gridFiles.isComplete()) return Optional.empty();
        String sig = activeSlot.key() + "|" + gridFiles.signature();
        if (sig.equals(lastGridSignature)) return Optional.empty();
        lastGridSignature = sig;
        return Optional.of(loadActive());
    }

    // -------------------- loads --------------------

    public CompletableFuture<LoadOutcome> loadSingle() {
        Optional<RigDescriptor> d = singleFiles.toDescriptor();
        if (d.isEmpty()) return incomplete(SlotId.SINGLE);
        return track(coordinator.load(SlotId.SINGLE, d.get(), slots.single().scale()));
    }

    public CompletableFuture<LoadOutcome> loadActive() {
        Optional<RigDescriptor> d = gridFiles.toDescriptor();
        if (d.isEmpty()) return incomplete(activeSlot);
        return track(coordinator.load(activeSlot, d.get(), gridLoadScale()));
    }

    /** @return number of load attempts */
    public CompletableFuture<Integer> fillEmpty() {
        Optional<RigDescriptor> d = gridFiles.toDescriptor();
        if (d.isEmpty()) {
            incomplete(activeSlot);
            return CompletableFuture.completedFuture(0);
        }
        inFlight++;
        return coordinator.fillEmpty(d.get(), gridLoadScale()).whenComplete((n, err) -> settle());
    }

    /** Clears every grid slot and forgets the grid files. */
    public int clearGrid() {
        int n = coordinator.clearAll();
        lastGridSignature = "";
        gridFiles = RigFileSelection.EMPTY;
        return n;
    }

    private float gridLoadScale() {
        return scaleAll ? gridScale : slots.get(activeSlot).scale();
    }

    private CompletableFuture<LoadOutcome> incomplete(SlotId id) {
        slots.update(id, s -> s.withError(RigFileSelection.INCOMPLETE_MESSAGE));
        return CompletableFuture.completedFuture(LoadOutcome.FAILED);
    }

    private CompletableFuture<LoadOutcome> track(CompletableFuture<LoadOutcome> f) {
        inFlight++;
        return f.whenComplete((o, err) -> settle());
    }

    private void settle() {
        inFlight = Math.max(0, inFlight - 1);
        if (inFlight == 0) offer();
    }

    // -------------------- view --------------------

    public void setMode(PresentationMode mode) {
        synchronizer.setMode(mode);
        offer();
    }

    public void toggleMode() {
        setMode(mode() == PresentationMode.SINGLE ? PresentationMode.GRID : PresentationMode.SINGLE);
    }

    public void selectSlot(SlotId id) {
        Objects.requireNonNull(id, "id");
        if (id.isSingle()) throw new IllegalArgumentException("active slot must be a grid slot");
        if (!id.equals(activeSlot)) log.debug("Active slot {}", id.label());
        activeSlot = id;
        offer();
    }

    public void setCellSize(int size) {
        int clamped = Math.max(MIN_CELL_SIZE, Math.min(MAX_CELL_SIZE, size));
        synchronizer.setCellSize(clamped);
    }

    public int cellSize() {
        return Math.round(synchronizer.cellSize());
    }

    public void setOutlinesVisible(boolean visible) {
        coordinator.setOutlinesVisible(visible);
    }

    public void toggleOutlines() {
        setOutlinesVisible(!synchronizer.outlinesVisible());
    }

    // -------------------- scale --------------------

    /** Scale shown for the current target under the current policy. */
    public float scale() {
        if (mode() == PresentationMode.SINGLE) return slots.single().scale();
        return scaleAll ? gridScale : slots.get(activeSlot).scale();
    }

    public void setScale(float scale) {
        float s = clampScale(scale);
        if (mode() == PresentationMode.SINGLE) {
            coordinator.setScale(SlotId.SINGLE, s);
        } else if (scaleAll) {
            gridScale = s;
            coordinator.setScaleAll(s);
        } else {
            coordinator.setScale(activeSlot, s);
        }
    }

    public void setScaleAll(boolean scaleAll) {
        this.scaleAll = scaleAll;
    }

    static float clampScale(float scale) {
        if (Float.isNaN(scale)) return 1f;
        return Math.max(MIN_SCALE, Math.min(MAX_SCALE, scale));
    }

    // -------------------- playback --------------------

    public void selectAnimation(String name) {
        coordinator.selectAnimation(target(), name);
    }

    public void selectSkin(String name) {
        coordinator.selectSkin(target(), name);
    }

    public void setLooping(boolean looping) {
        coordinator.setLooping(target(), looping);
    }

    public void togglePlaying() {
        coordinator.setPlaying(target(), !targetState().playing());
    }

    /** Steps the target's animation selection by {@code delta}, wrapping around. */
    public void cycleAnimation(int delta) {
        SlotState s = targetState();
        String next = cycle(s.animations(), s.selectedAnimation(), delta);
        if (next != null) selectAnimation(next);
    }

    public void cycleSkin(int delta) {
        SlotState s = targetState();
        String next = cycle(s.skins(), s.selectedSkin(), delta);
        if (next != null) selectSkin(next);
    }

    private static String cycle(List<String> names, String current, int delta) {
        if (names.isEmpty()) return null;
        int i = names.indexOf(current);
        int n = names.size();
        int next = i < 0 ? 0 : Math.floorMod(i + delta, n);
        return names.get(next);
    }

    // -------------------- frame / pointer --------------------

    public void tick(float tpf) {
        synchronizer.tick(tpf);
    }

    public void viewportResized() {
        synchronizer.relayout();
    }

    public void pointerDown(float clientX, float clientY) {
        synchronizer.pointerDown(clientX, clientY).ifPresent(this::selectSlot);
    }

    public void pointerMove(float clientX, float clientY) {
        synchronizer.pointerMove(clientX, clientY);
    }

    public void pointerLeave() {
        synchronizer.pointerLeave();
    }

    public void shutdown() {
        coordinator.shutdown();
        synchronizer.shutdown();
    }
}
