package org.foxesworld.rigview.engine.asset;

import java.util.List;
import java.util.Objects;

/** One load request: skeleton, atlas and the image pages. Not retained after binding. */
public record RigDescriptor(RigBlob skeleton, RigBlob atlas, List<RigBlob> images) {

    public RigDescriptor {
        Objects.requireNonNull(skeleton, "skeleton");
        Objects.requireNonNull(atlas, "atlas");
        images = List.copyOf(Objects.requireNonNull(images, "images"));
    }
}
