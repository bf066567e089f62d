package org.foxesworld.rigview.engine.stage;

import com.jme3.math.Vector2f;
import com.jme3.math.Vector3f;
import com.jme3.scene.Spatial;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.grid.GridMapper;
import org.foxesworld.rigview.engine.grid.GridMetrics;
import org.foxesworld.rigview.engine.lifecycle.RigArena;
import org.foxesworld.rigview.engine.rig.RigInstance;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the render tree in line with the presentation mode and the arena.
 *
 * <p>SINGLE shows the single-slot rig centered on the viewport plus its outline. GRID shows the
 * cell guide, the hover highlight, every grid rig at its cell center and, when enabled, the grid
 * outlines. Render-thread only; every entry point is a no-op until the stage is ready.</p>
 */
public final class StageSynchronizer {

    private static final Logger log = LogManager.getLogger(StageSynchronizer.class);

    static final OverlayStyle CELL_SHADOW = OverlayStyle.fill(0x15121c, 0.55f);
    static final OverlayStyle CELL_FILL = OverlayStyle.fill(0x2a2233, 1f);
    static final OverlayStyle GRID_FRAME = OverlayStyle.stroke(0x2f241e, 0.35f, 1f);
    static final OverlayStyle HOVER = OverlayStyle.fillAndStroke(0xff7a4a, 0.12f, 0xff7a4a, 0.35f, 1f);
    static final OverlayStyle OUTLINE = OverlayStyle.stroke(0xff6b6b, 0.85f, 1f);

    static final float SHADOW_DX = 2f;
    static final float SHADOW_DY = 4f;

    private final RenderStage stage;
    private final OverlayFactory overlays;
    private final RigArena arena;
    private final float gap;
    private final float radius;

    private PresentationMode mode = PresentationMode.SINGLE;
    private float cellSize;
    private boolean outlinesVisible;

    private Overlay guide;
    private Overlay hover;
    private SlotId hovered;

    public StageSynchronizer(RenderStage stage, OverlayFactory overlays, RigArena arena,
                             float cellSize, float gap, float radius, boolean outlinesVisible) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.overlays = Objects.requireNonNull(overlays, "overlays");
        this.arena = Objects.requireNonNull(arena, "arena");
        this.cellSize = requireCell(cellSize);
        this.gap = Math.max(gap, 0f);
        this.radius = Math.max(radius, 0f);
        this.outlinesVisible = outlinesVisible;
    }

    public PresentationMode mode() { return mode; }
    public float cellSize() { return cellSize; }
    public boolean outlinesVisible() { return outlinesVisible; }
    public SlotId hovered() { return hovered; }

    public GridMetrics metrics() {
        return GridMapper.metrics(stage.width(), stage.height(), cellSize);
    }

    // -------------------- mode --------------------

    public void setMode(PresentationMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (this.mode != mode) log.debug("Presentation mode {} -> {}", this.mode, mode);
        this.mode = mode;
        if (mode != PresentationMode.GRID) hovered = null;
        sync();
    }

    /** Rebuilds the render tree for the current mode. */
    public void sync() {
        if (!stage.isReady()) return;
        stage.detachAll();

        if (mode == PresentationMode.SINGLE) {
            RigInstance rig = arena.instance(SlotId.SINGLE);
            if (rig == null) return;
            attach(rig.node(), OverlayFactory.LAYER_RIG);
            centerSingle(rig);
            Overlay outline = arena.outline(SlotId.SINGLE);
            if (outline != null) {
                attach(outline.node(), OverlayFactory.LAYER_OUTLINE);
                drawOutline(rig, outline);
            }
            return;
        }

        if (guide == null) guide = overlays.create("grid:guide", OverlayFactory.LAYER_GUIDE);
        if (hover == null) hover = overlays.create("grid:hover", OverlayFactory.LAYER_HOVER);
        drawGuide();
        drawHover();
        attach(guide.node(), OverlayFactory.LAYER_GUIDE);
        attach(hover.node(), OverlayFactory.LAYER_HOVER);
        for (RigInstance rig : arena.gridInstances().values()) {
            attach(rig.node(), OverlayFactory.LAYER_RIG);
        }
        if (outlinesVisible) {
            for (Overlay outline : arena.gridOutlines().values()) {
                attach(outline.node(), OverlayFactory.LAYER_OUTLINE);
            }
        }
        layoutGrid();
    }

    // -------------------- per frame --------------------

    /** Advances every rig and redraws the visible outlines from the rigs' current bounds. */
    public void tick(float tpf) {
        for (RigInstance rig : arena.instances()) rig.update(tpf);
        if (!stage.isReady()) return;

        if (mode == PresentationMode.SINGLE) {
            RigInstance rig = arena.instance(SlotId.SINGLE);
            Overlay outline = arena.outline(SlotId.SINGLE);
            if (rig != null && outline != null) drawOutline(rig, outline);
        } else if (outlinesVisible) {
            for (Map.Entry<SlotId, RigInstance> e : arena.gridInstances().entrySet()) {
                Overlay outline = arena.outline(e.getKey());
                if (outline != null) drawOutline(e.getValue(), outline);
            }
        }
    }

    // -------------------- layout --------------------

    /** Re-applies positions and the guide after a viewport or cell-size change. */
    public void relayout() {
        if (!stage.isReady()) return;
        if (mode == PresentationMode.SINGLE) {
            RigInstance rig = arena.instance(SlotId.SINGLE);
            if (rig != null) centerSingle(rig);
        } else {
            hovered = null;
            drawGuide();
            layoutGrid();
            drawHover();
        }
    }

    public void setCellSize(float cellSize) {
        this.cellSize = requireCell(cellSize);
        if (mode == PresentationMode.GRID) relayout();
    }

    /** Re-positions one slot's rig after its scale or skin changed. */
    public void reposition(SlotId id) {
        if (!stage.isReady()) return;
        RigInstance rig = arena.instance(id);
        if (rig == null) return;
        if (id.isSingle()) {
            if (mode == PresentationMode.SINGLE) centerSingle(rig);
        } else {
            placeInCell(rig, metrics(), id);
        }
    }

    private void layoutGrid() {
        GridMetrics m = metrics();
        arena.gridInstances().forEach((id, rig) -> placeInCell(rig, m, id));
    }

    private static void placeInCell(RigInstance rig, GridMetrics m, SlotId id) {
        Vector2f c = GridMapper.cellCenter(m, id);
        rig.setPosition(c.x, c.y);
    }

    /** Pivot on the local bounds center, position on the viewport center. */
    private void centerSingle(RigInstance rig) {
        Bounds2f local = rig.localBounds();
        rig.setPivot(local.centerX(), local.centerY());
        rig.setPosition(stage.width() / 2f, stage.height() / 2f);
    }

    // -------------------- outlines --------------------

    /**
     * Shows or hides the grid outlines. Hiding clears the drawings but keeps the objects;
     * the caller creates missing outlines before showing them.
     */
    public void setOutlinesVisible(boolean visible) {
        this.outlinesVisible = visible;
        if (!visible) {
            arena.gridOutlines().values().forEach(Overlay::clear);
        }
        if (mode == PresentationMode.GRID) sync();
    }

    private void disableOutlines() {
        if (!outlinesVisible) return;
        outlinesVisible = false;
        arena.gridOutlines().values().forEach(Overlay::clear);
        log.debug("Grid outlines hidden by pointer");
    }

    private static void drawOutline(RigInstance rig, Overlay outline) {
        outline.clear();
        outline.rect(rig.screenBounds(), 0f, OUTLINE);
    }

    // -------------------- pointer --------------------

    /**
     * In GRID mode the first pointer-down hides the grid outlines; the returned slot is the cell
     * under the pointer, if any.
     */
    public Optional<SlotId> pointerDown(float clientX, float clientY) {
        if (mode != PresentationMode.GRID || !stage.isReady()) return Optional.empty();
        disableOutlines();
        Vector2f p = stage.toViewport(clientX, clientY);
        return GridMapper.hitTest(metrics(), p.x, p.y);
    }

    public void pointerMove(float clientX, float clientY) {
        if (!stage.isReady()) return;
        SlotId next = null;
        if (mode == PresentationMode.GRID) {
            Vector2f p = stage.toViewport(clientX, clientY);
            next = GridMapper.hitTest(metrics(), p.x, p.y).orElse(null);
        }
        if (Objects.equals(next, hovered)) return;
        hovered = next;
        drawHover();
    }

    public void pointerLeave() {
        if (hovered == null) return;
        hovered = null;
        drawHover();
    }

    // -------------------- drawing --------------------

    private void drawGuide() {
        if (guide == null) return;
        GridMetrics m = metrics();
        guide.clear();
        for (SlotId id : SlotId.gridIds()) {
            Bounds2f cell = GridMapper.drawRect(m, id, gap);
            guide.rect(cell.offset(SHADOW_DX, SHADOW_DY), radius, CELL_SHADOW);
            guide.rect(cell, radius, CELL_FILL);
        }
        guide.rect(GridMapper.gridRect(m), 0f, GRID_FRAME);
    }

    private void drawHover() {
        if (hover == null) return;
        hover.clear();
        if (hovered == null || mode != PresentationMode.GRID) return;
        hover.rect(GridMapper.drawRect(metrics(), hovered, gap), radius, HOVER);
    }

    // -------------------- teardown --------------------

    /** Detaches everything and destroys the guide and hover overlays. */
    public void shutdown() {
        if (stage.isReady()) stage.detachAll();
        if (guide != null) guide.destroy();
        if (hover != null) hover.destroy();
        guide = null;
        hover = null;
        hovered = null;
    }

    private void attach(Spatial node, int layer) {
        Vector3f t = node.getLocalTranslation();
        node.setLocalTranslation(t.x, t.y, layer);
        stage.attach(node);
    }

    private static float requireCell(float cellSize) {
        if (!(cellSize > 0f) || Float.isInfinite(cellSize)) {
            throw new IllegalArgumentException("cell size must be positive: " + cellSize);
        }
        return cellSize;
    }
}
