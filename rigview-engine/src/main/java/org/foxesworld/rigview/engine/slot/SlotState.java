package org.foxesworld.rigview.engine.slot;

import java.util.List;
import java.util.Objects;

/**
 * Immutable slot record. Every change produces a new instance through one of the
 * {@code with*} methods so readers never see half-applied updates.
 */
public record SlotState(
        SlotId id,
        SlotPhase phase,
        List<String> animations,
        String selectedAnimation,
        List<String> skins,
        String selectedSkin,
        boolean looping,
        boolean playing,
        float scale,
        String status,
        String error,
        long generation
) {

    public static final String STATUS_EMPTY = "Empty slot.";
    public static final String STATUS_LOADING = "Loading assets...";
    public static final String STATUS_LOADED = "Spine loaded.";
    public static final String STATUS_FAILED = "Load failed.";

    public SlotState {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(phase, "phase");
        animations = animations == null ? List.of() : List.copyOf(animations);
        skins = skins == null ? List.of() : List.copyOf(skins);
        selectedAnimation = selectedAnimation == null ? "" : selectedAnimation;
        selectedSkin = selectedSkin == null ? "" : selectedSkin;
        status = status == null ? "" : status;
    }

    public static SlotState empty(SlotId id) {
        return new SlotState(id, SlotPhase.EMPTY, List.of(), "", List.of(), "", true, true, 1f,
                STATUS_EMPTY, null, 0L);
    }

    /** Presence flag: a rig is bound to this slot. */
    public boolean hasRig() {
        return phase == SlotPhase.BOUND;
    }

    public boolean isLoading() {
        return phase == SlotPhase.LOADING;
    }

    public String label() {
        return id.label();
    }

    /** Back to empty defaults; keeps generation, loop/play flags and scale. */
    public SlotState cleared() {
        return new SlotState(id, SlotPhase.EMPTY, List.of(), "", List.of(), "", looping, playing, scale,
                STATUS_EMPTY, null, generation);
    }

    public SlotState loading(long newGeneration) {
        return new SlotState(id, SlotPhase.LOADING, List.of(), "", List.of(), "", looping, playing, scale,
                STATUS_LOADING, null, newGeneration);
    }

    public SlotState bound(List<String> animations, String animation, List<String> skins, String skin, float scale) {
        return new SlotState(id, SlotPhase.BOUND, animations, animation, skins, skin, looping, playing, scale,
                STATUS_LOADED, null, generation);
    }

    public SlotState failed(String message) {
        return new SlotState(id, SlotPhase.FAILED, List.of(), "", List.of(), "", looping, playing, scale,
                STATUS_FAILED, message, generation);
    }

    public SlotState withError(String message) {
        return new SlotState(id, phase, animations, selectedAnimation, skins, selectedSkin, looping, playing,
                scale, status, message, generation);
    }

    public SlotState withScale(float scale) {
        return new SlotState(id, phase, animations, selectedAnimation, skins, selectedSkin, looping, playing,
                scale, status, error, generation);
    }

    public SlotState withLooping(boolean looping) {
        return new SlotState(id, phase, animations, selectedAnimation, skins, selectedSkin, looping, playing,
                scale, status, error, generation);
    }

    public SlotState withPlaying(boolean playing) {
        return new SlotState(id, phase, animations, selectedAnimation, skins, selectedSkin, looping, playing,
                scale, status, error, generation);
    }

    public SlotState withSelectedAnimation(String name) {
        return new SlotState(id, phase, animations, name, skins, selectedSkin, looping, playing,
                scale, status, error, generation);
    }

    public SlotState withSelectedSkin(String name) {
        return new SlotState(id, phase, animations, selectedAnimation, skins, name, looping, playing,
                scale, status, error, generation);
    }

    public SlotState withGeneration(long generation) {
        return new SlotState(id, phase, animations, selectedAnimation, skins, selectedSkin, looping, playing,
                scale, status, error, generation);
    }
}
