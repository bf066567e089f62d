package org.foxesworld.rigview.engine.asset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Files picked together by the user, sorted by extension: first {@code .json}, first
 * {@code .atlas}, every {@code .png}. Anything else is ignored.
 */
public record RigFileSelection(RigBlob skeleton, RigBlob atlas, List<RigBlob> images) {

    public static final String INCOMPLETE_MESSAGE = "Select the .json, .atlas, and at least one .png file.";

    public static final RigFileSelection EMPTY = new RigFileSelection(null, null, List.of());

    public RigFileSelection {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static RigFileSelection classify(Collection<? extends RigBlob> files) {
        if (files == null || files.isEmpty()) return EMPTY;

        RigBlob json = null;
        RigBlob atlas = null;
        List<RigBlob> images = new ArrayList<>();
        for (RigBlob f : files) {
            if (f == null) continue;
            switch (f.extension()) {
                case "json" -> { if (json == null) json = f; }
                case "atlas" -> { if (atlas == null) atlas = f; }
                case "png" -> images.add(f);
                default -> { }
            }
        }
        return new RigFileSelection(json, atlas, images);
    }

    public boolean isComplete() {
        return skeleton != null && atlas != null && !images.isEmpty();
    }

    public boolean isEmpty() {
        return skeleton == null && atlas == null && images.isEmpty();
    }

    public Optional<RigDescriptor> toDescriptor() {
        return isComplete() ? Optional.of(new RigDescriptor(skeleton, atlas, images)) : Optional.empty();
    }

    /**
     * Identity of the picked files (names, modification times, image sizes). Two picks with the
     * same signature are the same load.
     */
    public String signature() {
        StringJoiner j = new StringJoiner("|");
        if (skeleton != null) j.add(skeleton.name()).add(Long.toString(skeleton.lastModified()));
        if (atlas != null) j.add(atlas.name()).add(Long.toString(atlas.lastModified()));
        for (RigBlob img : images) {
            j.add(img.name() + "-" + img.lastModified() + "-" + img.size());
        }
        return j.toString();
    }

    /** Human-readable file list for status lines. */
    public String describe() {
        StringJoiner j = new StringJoiner(", ");
        if (skeleton != null) j.add(skeleton.name());
        if (atlas != null) j.add(atlas.name());
        for (RigBlob img : images) j.add(img.name());
        return j.length() == 0 ? "Pick JSON, atlas, and PNG pages together" : j.toString();
    }
}
