// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers creating annotation values and reading span locations in tests.
 */
public class LayerFixtures {

    /** Returns a map of the given alternating keys and values. Values may be null. */
    public static Map<String, Object> values(Object ... keysAndValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2)
            values.put((String)keysAndValues[i], keysAndValues[i + 1]);
        return values;
    }

    /** Returns the [start, end] of each span of the given layer */
    public static List<List<Integer>> locations(Layer layer) {
        List<List<Integer>> locations = new ArrayList<>();
        for (AnnotatedSpan span : layer)
            locations.add(List.of(span.start(), span.end()));
        return locations;
    }

    /** Returns the [start, end] of each annotation of the given layer */
    public static List<List<Integer>> annotationLocations(Layer layer) {
        List<List<Integer>> locations = new ArrayList<>();
        for (AnnotatedSpan span : layer)
            for (int i = 0; i < span.annotations().size(); i++)
                locations.add(List.of(span.start(), span.end()));
        return locations;
    }

}
