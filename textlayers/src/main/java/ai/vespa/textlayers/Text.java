// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A raw text string with named layers of annotations over it.
 *
 * <p>Layers are attached with {@link #addLayer}, which is all or nothing: a layer which does not fit
 * the text or the layer it depends on is rejected and the text is left unchanged.
 * Layers are kept in the order they were attached, which is always a dependency order.</p>
 *
 * <p>A text and its layers are a single unit of mutable state and must not be shared between threads
 * while being modified.</p>
 */
public final class Text {

    private static final Logger log = Logger.getLogger(Text.class.getName());

    /** Names which cannot be used as layer names as they are members of a text */
    private static final Set<String> reservedNames = Set.of("text", "meta", "layers", "layer", "attributes");

    private final String text;
    private final Map<String, Object> meta = new LinkedHashMap<>();
    private final Map<String, Layer> layers = new LinkedHashMap<>();

    public Text(String text) {
        this.text = Objects.requireNonNull(text, "Text cannot be null");
    }

    /** Returns the raw text */
    public String text() { return text; }

    /** Returns the metadata of this text. This is mutable and keeps insertion order. */
    public Map<String, Object> meta() { return meta; }

    /**
     * Attaches a layer to this text.
     *
     * @return this for chaining
     * @throws LayerNameCollisionException if this already has a layer of this name, or the name is reserved
     * @throws MissingDependencyException if the layer depends on a layer which is not in this text
     * @throws NoMatchingParentSpanException if a span of a parent or fragment layer does not fit the layer it depends on
     * @throws NoMatchingEnvelopedSpanException if a child of a span of an enveloping layer is not a span of the enveloped layer
     * @throws ConsistencyException if the layer is otherwise invalid, or has spans beyond the end of this text
     * @throws IllegalArgumentException if the layer is already attached to a text
     */
    public Text addLayer(Layer layer) {
        Objects.requireNonNull(layer, "Layer cannot be null");
        if (reservedNames.contains(layer.name()))
            throw new LayerNameCollisionException("Layer name '" + layer.name() + "' is reserved");
        if (layers.containsKey(layer.name()))
            throw new LayerNameCollisionException("This text already has a layer named '" + layer.name() + "'");
        if (layer.isBound())
            throw new IllegalArgumentException(layer + " is already attached to a text");

        if (layer.topology().isDependent()) {
            String reference = layer.topology().reference().get();
            Layer dependency = layers.get(reference);
            if (dependency == null)
                throw new MissingDependencyException("Layer '" + layer.name() + "' is " + layer.topology() +
                                                     " but this text has no layer '" + reference + "'");
            layer.requireAligned(layer.spanList(), dependency);
        }
        SpanConsistency.audit(layer, layer.spanList(), this);

        layers.put(layer.name(), layer);
        layer.bind(this);
        resolveForeignAttributes();
        log.log(Level.FINE, () -> "Attached " + layer + " to text of length " + text.length());
        return this;
    }

    /** Returns whether this has a layer of the given name */
    public boolean hasLayer(String name) {
        return layers.containsKey(name);
    }

    /**
     * Returns the layer of the given name.
     *
     * @throws IllegalArgumentException if this has no such layer
     */
    public Layer layer(String name) {
        Layer layer = layers.get(name);
        if (layer == null)
            throw new IllegalArgumentException("This text has no layer '" + name + "', layers are " + layers.keySet());
        return layer;
    }

    /** Returns the layers of this in the order they were attached */
    public Collection<Layer> layers() {
        return Collections.unmodifiableCollection(layers.values());
    }

    /** Returns the names of the layers of this in the order they were attached */
    public Set<String> layerNames() {
        return Collections.unmodifiableSet(layers.keySet());
    }

    /**
     * Removes the layer of the given name.
     *
     * @return the removed layer, which is no longer attached
     * @throws DependentLayersException if other layers of this depend on it
     */
    public Layer removeLayer(String name) {
        return removeLayer(name, false);
    }

    /**
     * Removes the layer of the given name.
     *
     * @param cascade whether to also remove all the layers depending on this, directly or transitively.
     *                If false, this fails if any layer depends on it.
     * @return the removed layer, which is no longer attached
     * @throws DependentLayersException if other layers depend on it and cascade is false
     */
    public Layer removeLayer(String name, boolean cascade) {
        Layer layer = layer(name);
        List<Layer> dependents = dependentsOf(name);
        if ( ! dependents.isEmpty() && ! cascade)
            throw new DependentLayersException("Cannot remove layer '" + name + "': layers " + names(dependents) +
                                               " depend on it");
        for (int i = dependents.size() - 1; i >= 0; i--)
            detach(dependents.get(i));
        detach(layer);
        resolveForeignAttributes();
        return layer;
    }

    private void detach(Layer layer) {
        layers.remove(layer.name());
        layer.unbind();
        log.log(Level.FINE, () -> "Removed " + layer);
    }

    /** Returns all layers depending on the given layer, directly or transitively, in attachment order */
    public List<Layer> dependentsOf(String name) {
        Set<String> dependencies = new LinkedHashSet<>();
        dependencies.add(name);
        List<Layer> dependents = new ArrayList<>();
        for (Layer layer : layers.values()) { // attachment order is dependency order
            if (layer.topology().reference().map(dependencies::contains).orElse(false)) {
                dependents.add(layer);
                dependencies.add(layer.name());
            }
        }
        return dependents;
    }

    /** Returns the layers which depend directly on the given layer */
    List<Layer> directDependentsOf(String name) {
        List<Layer> dependents = new ArrayList<>();
        for (Layer layer : layers.values())
            if (layer.topology().dependsOn(name))
                dependents.add(layer);
        return dependents;
    }

    /**
     * Rebuilds the table of foreign attributes of each layer: those of the layers it is attached to as a parent,
     * nearest first, and those of the layers attached to it as their parent.
     * Attributes declared by the layer itself, or already provided by a nearer layer, are skipped.
     */
    private void resolveForeignAttributes() {
        for (Layer layer : layers.values()) {
            Map<String, String> foreign = new LinkedHashMap<>();
            Set<String> own = Set.copyOf(layer.attributeNames());
            Layer ancestor = parentOf(layer);
            Set<String> visited = new LinkedHashSet<>();
            while (ancestor != null && visited.add(ancestor.name())) {
                for (String attribute : ancestor.attributeNames())
                    if ( ! own.contains(attribute))
                        foreign.putIfAbsent(attribute, ancestor.name());
                ancestor = parentOf(ancestor);
            }
            for (Layer child : layers.values()) {
                if ( ! child.topology().equals(Topology.parent(layer.name()))) continue;
                for (String attribute : child.attributeNames())
                    if ( ! own.contains(attribute))
                        foreign.putIfAbsent(attribute, child.name());
            }
            layer.setForeignAttributes(foreign);
        }
    }

    private Layer parentOf(Layer layer) {
        return layer.parent().map(layers::get).orElse(null);
    }

    private static List<String> names(List<Layer> layers) {
        List<String> names = new ArrayList<>(layers.size());
        for (Layer layer : layers)
            names.add(layer.name());
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof Text other)) return false;
        return text.equals(other.text) && meta.equals(other.meta) && layers.equals(other.layers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, meta, layers.keySet());
    }

    @Override
    public String toString() {
        return "Text(" + (text.length() > 40 ? text.substring(0, 40) + "..." : text) + ", layers=" + layers.keySet() + ")";
    }

}
