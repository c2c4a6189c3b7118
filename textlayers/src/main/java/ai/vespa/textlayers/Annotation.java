// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable set of attribute values attached to one span location of a layer.
 * Values may be null. Annotations are equal if they hold the same attribute values.
 */
public final class Annotation {

    private final Map<String, Object> values;

    private Annotation(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Creates an annotation holding a copy of the given values, in the iteration order of the given map */
    public static Annotation of(Map<String, ?> values) {
        return new Annotation(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of the given attribute.
     *
     * @throws UnknownAttributeException if this has no such attribute
     */
    public Object get(String attribute) {
        if ( ! values.containsKey(attribute))
            throw new UnknownAttributeException("Unknown attribute '" + attribute + "', attributes are " + values.keySet());
        return values.get(attribute);
    }

    /** Returns the value of the given attribute cast to the given type */
    public <T> T get(String attribute, Class<T> type) {
        Object value = get(attribute);
        if (value != null && ! type.isInstance(value))
            throw new IllegalArgumentException("Attribute '" + attribute + "' has value '" + value + "' of " +
                                               value.getClass() + ", not " + type);
        return type.cast(value);
    }

    /** Returns a copy of this where the given attribute has the given value */
    public Annotation with(String attribute, Object value) {
        get(attribute);
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(attribute, value);
        return new Annotation(copy);
    }

    public Set<String> attributeNames() { return values.keySet(); }

    /** Returns the values of this as an unmodifiable map */
    public Map<String, Object> asMap() { return values; }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof Annotation other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Annotation" + values;
    }

}
