package org.foxesworld.rigview.engine.asset.jme;

import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What the viewer reads from a skeleton file: declared animations (with durations), skins and
 * setup-pose bounds. Bounds are in rig-local viewport space (y down).
 */
public record SkeletonData(String name, String version, Bounds2f bounds,
                           List<Animation> animations, List<String> skins) {

    public record Animation(String name, float duration) {}

    public SkeletonData {
        name = name == null ? "" : name;
        version = version == null ? "" : version;
        bounds = bounds == null ? Bounds2f.EMPTY : bounds;
        animations = List.copyOf(animations);
        skins = List.copyOf(skins);
    }

    public List<String> animationNames() {
        List<String> out = new ArrayList<>(animations.size());
        for (Animation a : animations) out.add(a.name());
        return out;
    }

    public Optional<Animation> animation(String name) {
        for (Animation a : animations) {
            if (a.name().equals(name)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
