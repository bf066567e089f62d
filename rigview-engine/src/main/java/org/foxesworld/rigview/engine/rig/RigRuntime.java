package org.foxesworld.rigview.engine.rig;

/** Skeletal-animation runtime: turns loaded skeleton + atlas registrations into a live rig. */
public interface RigRuntime {

    /**
     * Both keys must be loaded in the asset manager the runtime reads from.
     *
     * @throws RuntimeException when the rig cannot be constructed
     */
    RigInstance instantiate(String skeletonKey, String atlasKey);
}
