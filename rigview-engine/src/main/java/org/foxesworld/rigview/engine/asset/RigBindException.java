package org.foxesworld.rigview.engine.asset;

import java.util.List;
import java.util.Objects;

/**
 * Failure of a single bind attempt. Always caught at the lifecycle boundary and turned
 * into the slot's error message; never escapes past the coordinator.
 */
public final class RigBindException extends RuntimeException {

    public enum Kind {
        /** Atlas text declares no pages. */
        MALFORMED_ATLAS,
        /** Some declared pages have no matching image. */
        MISSING_PAGES,
        /** The asset manager rejected the registration or the load. */
        REGISTRATION_FAILURE,
        /** Assets loaded but the rig could not be constructed from them. */
        INSTANTIATION_FAILURE,
        /** Render surface does not exist yet. */
        RENDERER_UNAVAILABLE
    }

    private final Kind kind;
    private final List<String> missingPages;

    private RigBindException(Kind kind, String message, List<String> missingPages, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.missingPages = missingPages == null ? List.of() : List.copyOf(missingPages);
    }

    public static RigBindException malformedAtlas() {
        return new RigBindException(Kind.MALFORMED_ATLAS, "Atlas pages not found. Check the .atlas file.", null, null);
    }

    public static RigBindException missingPages(List<String> names) {
        return new RigBindException(Kind.MISSING_PAGES, "Missing atlas pages: " + String.join(", ", names), names, null);
    }

    public static RigBindException registrationFailure(String detail, Throwable cause) {
        return new RigBindException(Kind.REGISTRATION_FAILURE, "Failed to load assets: " + detail, null, cause);
    }

    public static RigBindException instantiationFailure(String detail, Throwable cause) {
        return new RigBindException(Kind.INSTANTIATION_FAILURE, "Failed to create rig: " + detail, null, cause);
    }

    public static RigBindException rendererUnavailable() {
        return new RigBindException(Kind.RENDERER_UNAVAILABLE, "Renderer is not ready.", null, null);
    }

    public Kind kind() { return kind; }

    /** Page names absent from the supplied images; empty for other kinds. */
    public List<String> missingPages() { return missingPages; }
}
