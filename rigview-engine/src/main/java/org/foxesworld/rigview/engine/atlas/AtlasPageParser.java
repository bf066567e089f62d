package org.foxesworld.rigview.engine.atlas;

import org.foxesworld.rigview.engine.asset.RigBindException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Extracts page names from atlas descriptor text.
 *
 * <p>A page is a non-empty line without a colon whose next non-empty line starts with
 * {@code size:}. Order and duplicates are kept as declared.</p>
 */
public final class AtlasPageParser {

    private static final String SIZE_PREFIX = "size:";

    private AtlasPageParser() {}

    /**
     * @throws RigBindException of kind {@code MALFORMED_ATLAS} when no page is declared
     */
    public static List<String> parsePageNames(String atlasText) {
        List<String> names = extractPageNames(atlasText);
        if (names.isEmpty()) throw RigBindException.malformedAtlas();
        return names;
    }

    /** Same scan as {@link #parsePageNames(String)} but returns an empty list instead of failing. */
    public static List<String> extractPageNames(String atlasText) {
        if (atlasText == null || atlasText.isEmpty()) return List.of();

        String[] lines = atlasText.split("\\r?\\n", -1);
        List<String> names = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.indexOf(':') >= 0) continue;

            String next = nextNonEmpty(lines, i + 1);
            if (next != null && next.startsWith(SIZE_PREFIX)) {
                names.add(line);
            }
        }
        return Collections.unmodifiableList(names);
    }

    private static String nextNonEmpty(String[] lines, int from) {
        for (int j = from; j < lines.length; j++) {
            String candidate = lines[j].trim();
            if (!candidate.isEmpty()) return candidate;
        }
        return null;
    }
}
