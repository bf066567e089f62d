package org.foxesworld.rigview.engine.asset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Image data handed to the asset manager together with an atlas registration. */
public sealed interface PageImages permits PageImages.Single, PageImages.Named {

    /** One page, one image; names are not compared. */
    record Single(RigBlob image) implements PageImages {
        public Single {
            Objects.requireNonNull(image, "image");
        }

        @Override public int count() { return 1; }
    }

    /** Page name to image, in atlas declaration order. */
    record Named(Map<String, RigBlob> byPage) implements PageImages {
        public Named {
            byPage = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(byPage, "byPage")));
        }

        @Override public int count() { return byPage.size(); }
    }

    int count();

    static PageImages single(RigBlob image) {
        return new Single(image);
    }

    static PageImages named(Map<String, RigBlob> byPage) {
        return new Named(byPage);
    }
}
