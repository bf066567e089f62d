package org.foxesworld.rigview.engine.lifecycle;

import org.foxesworld.rigview.engine.asset.AssetBundle;
import org.foxesworld.rigview.engine.rig.RigInstance;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.stage.Overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-slot live objects: rig instance, asset bundle, outline overlay.
 *
 * <p>A slot has an instance exactly when it has a bundle; both go in and out together.
 * Only {@link RigLifecycleCoordinator} mutates the arena. Render-thread only.</p>
 */
public final class RigArena {

    /** Instance and bundle of one slot. */
    public record Entry(RigInstance instance, AssetBundle bundle) {
        public Entry {
            Objects.requireNonNull(instance, "instance");
            Objects.requireNonNull(bundle, "bundle");
        }
    }

    private final Map<SlotId, Entry> entries = new LinkedHashMap<>();
    private final Map<SlotId, Overlay> outlines = new LinkedHashMap<>();

    // -------------------- mutators (coordinator) --------------------

    void put(SlotId id, RigInstance instance, AssetBundle bundle) {
        Objects.requireNonNull(id, "id");
        if (entries.containsKey(id)) {
            throw new IllegalStateException("slot already occupied: " + id);
        }
        entries.put(id, new Entry(instance, bundle));
    }

    Entry remove(SlotId id) {
        return entries.remove(id);
    }

    void putOutline(SlotId id, Overlay outline) {
        Objects.requireNonNull(outline, "outline");
        Overlay prev = outlines.put(Objects.requireNonNull(id, "id"), outline);
        if (prev != null && prev != outline) prev.destroy();
    }

    Overlay removeOutline(SlotId id) {
        return outlines.remove(id);
    }

    // -------------------- readers --------------------

    public RigInstance instance(SlotId id) {
        Entry e = entries.get(id);
        return e == null ? null : e.instance();
    }

    public AssetBundle bundle(SlotId id) {
        Entry e = entries.get(id);
        return e == null ? null : e.bundle();
    }

    public Overlay outline(SlotId id) {
        return outlines.get(id);
    }

    public boolean isOccupied(SlotId id) {
        return entries.containsKey(id);
    }

    public List<SlotId> occupied() {
        return List.copyOf(entries.keySet());
    }

    /** Grid instances keyed by slot, in insertion order. */
    public Map<SlotId, RigInstance> gridInstances() {
        Map<SlotId, RigInstance> out = new LinkedHashMap<>();
        entries.forEach((id, e) -> {
            if (!id.isSingle()) out.put(id, e.instance());
        });
        return Collections.unmodifiableMap(out);
    }

    /** Grid outlines keyed by slot. */
    public Map<SlotId, Overlay> gridOutlines() {
        Map<SlotId, Overlay> out = new LinkedHashMap<>();
        outlines.forEach((id, o) -> {
            if (!id.isSingle()) out.put(id, o);
        });
        return Collections.unmodifiableMap(out);
    }

    public List<RigInstance> instances() {
        List<RigInstance> out = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) out.add(e.instance());
        return out;
    }

    public int size() {
        return entries.size();
    }

    public int outlineCount() {
        return outlines.size();
    }
}
