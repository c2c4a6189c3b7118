// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.Objects;
import java.util.Optional;

/**
 * How the spans of a layer relate to the spans of another layer of the same text.
 *
 * <ul>
 *     <li>{@link Kind#INDEPENDENT}: the layer has its own elementary spans</li>
 *     <li>{@link Kind#PARENT}: every span has the boundaries of a span of the parent layer, adding attributes to it</li>
 *     <li>{@link Kind#ENVELOPING}: every span envelops an ordered run of spans of the enveloped layer</li>
 *     <li>{@link Kind#FRAGMENT}: every span lies inside a single span of the referenced layer</li>
 * </ul>
 */
public final class Topology {

    public enum Kind { INDEPENDENT, PARENT, ENVELOPING, FRAGMENT }

    private static final Topology independent = new Topology(Kind.INDEPENDENT, null);

    private final Kind kind;
    private final String reference;

    private Topology(Kind kind, String reference) {
        this.kind = kind;
        this.reference = reference;
    }

    public static Topology independent() { return independent; }

    public static Topology parent(String layer) { return new Topology(Kind.PARENT, requireLayerName(layer)); }

    public static Topology enveloping(String layer) { return new Topology(Kind.ENVELOPING, requireLayerName(layer)); }

    public static Topology fragmentOf(String layer) { return new Topology(Kind.FRAGMENT, requireLayerName(layer)); }

    public Kind kind() { return kind; }

    /** Returns the name of the layer this depends on, or empty if this is independent */
    public Optional<String> reference() { return Optional.ofNullable(reference); }

    public boolean isDependent() { return kind != Kind.INDEPENDENT; }

    /** Returns whether the layer of this topology depends directly on the given layer */
    public boolean dependsOn(String layer) { return layer.equals(reference); }

    private static String requireLayerName(String layer) {
        Objects.requireNonNull(layer, "Referenced layer name cannot be null");
        Names.requireIdentifier(layer, "layer");
        return layer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if ( ! (o instanceof Topology other)) return false;
        return kind == other.kind && Objects.equals(reference, other.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, reference);
    }

    @Override
    public String toString() {
        return kind == Kind.INDEPENDENT ? "independent" : kind.name().toLowerCase() + "(" + reference + ")";
    }

}
