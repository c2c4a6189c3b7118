// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named, ordered collection of annotated span locations over a text.
 *
 * <p>A layer has a fixed schema: the ordered names of its attributes with their default values, whether
 * it is ambiguous (a location may hold several alternative annotations), and its {@link Topology}.
 * Its spans are kept strictly increasing by (start, end), and no two spans share a location.</p>
 *
 * <p>A layer is built unattached, then attached to a {@link Text} with {@link Text#addLayer}, which validates it
 * against the layer it depends on. Spans added to an attached dependent layer are validated immediately.
 * Bulk rewrites of an attached layer go through {@link #retag}.</p>
 *
 * <p>Layers are not thread safe.</p>
 */
public final class Layer implements Iterable<AnnotatedSpan> {

    private static final Logger log = Logger.getLogger(Layer.class.getName());

    private static final Set<String> reservedAttributes = Set.of("start", "end", "text");

    private final String name;
    private final ImmutableList<String> attributes;
    private final Map<String, Object> defaults;
    private final boolean ambiguous;
    private final Topology topology;

    private List<AnnotatedSpan> spans = new ArrayList<>();

    /** The text this is attached to, or null */
    private Text text = null;

    /** Attributes of other layers of the text which spans of this may resolve, mapped to the layer declaring them */
    private Map<String, String> foreignAttributes = Map.of();

    private Layer(Builder builder) {
        Names.requireIdentifier(builder.name, "layer");
        Set<String> seen = new HashSet<>();
        for (String attribute : builder.attributes) {
            Names.requireIdentifier(attribute, "attribute");
            if (reservedAttributes.contains(attribute))
                throw new InvalidNameException("Attribute name '" + attribute + "' is reserved");
            if ( ! seen.add(attribute))
                throw new InvalidNameException("Attribute '" + attribute + "' is declared twice in layer '" + builder.name + "'");
        }
        for (String attribute : builder.defaults.keySet())
            if ( ! seen.contains(attribute))
                throw new UnknownAttributeException("Default value given for undeclared attribute '" + attribute +
                                                    "' in layer '" + builder.name + "'");
        if (builder.topology.dependsOn(builder.name))
            throw new IllegalArgumentException("Layer '" + builder.name + "' cannot depend on itself");

        this.name = builder.name;
        this.attributes = ImmutableList.copyOf(builder.attributes);
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (String attribute : attributes)
            defaults.put(attribute, builder.defaults.get(attribute));
        this.defaults = Collections.unmodifiableMap(defaults);
        this.ambiguous = builder.ambiguous;
        this.topology = builder.topology;
    }

    public String name() { return name; }

    /** Returns the names of the attributes of this, in declaration order */
    public List<String> attributeNames() { return attributes; }

    /** Returns the default value of each attribute, in declaration order. Values may be null. */
    public Map<String, Object> defaults() { return defaults; }

    public boolean isAmbiguous() { return ambiguous; }

    public Topology topology() { return topology; }

    /** Returns the name of the layer this is attached to as a parent, if any */
    public Optional<String> parent() { return referenceIf(Topology.Kind.PARENT); }

    /** Returns the name of the layer whose spans this envelops, if any */
    public Optional<String> enveloping() { return referenceIf(Topology.Kind.ENVELOPING); }

    /** Returns the name of the layer this is a fragment of, if any */
    public Optional<String> fragmentOf() { return referenceIf(Topology.Kind.FRAGMENT); }

    private Optional<String> referenceIf(Topology.Kind kind) {
        return topology.kind() == kind ? topology.reference() : Optional.empty();
    }

    /**
     * Returns the name of the base layer of this: the base of its parent if this is attached to a parent,
     * and this layer otherwise.
     */
    public String base() {
        if (topology.kind() != Topology.Kind.PARENT) return name;
        String parent = topology.reference().get();
        if (text != null && text.hasLayer(parent)) return text.layer(parent).base();
        return parent;
    }

    /** Returns whether this is attached to a text */
    public boolean isBound() { return text != null; }

    /**
     * Returns the text this is attached to.
     *
     * @throws UnboundException if this is not attached to a text
     */
    public Text textObject() {
        if (text == null) throw new UnboundException("Layer '" + name + "' is not attached to a text");
        return text;
    }

    /** Returns the attributes of other layers of the text which the spans of this can resolve, and their layers */
    public Map<String, String> foreignAttributes() { return foreignAttributes; }

    // ---------------- Adding spans

    /** Same as {@code addSpan(Span.of(start, end), values)} */
    public AnnotatedSpan addSpan(int start, int end, Map<String, ?> values) {
        return addSpan(Span.of(start, end), values);
    }

    /**
     * Adds an annotation at the given location. Attributes not given get their default value.
     * If the location is already present, the annotation is added to it if this is ambiguous.
     *
     * @param span the location, which must be enveloping if and only if this is an enveloping layer
     *             (or attached to a parent layer which is)
     * @param values the attribute values of the annotation
     * @return the span at the location
     * @throws DuplicateSpanException if this is not ambiguous and already has a span at this location
     * @throws AttributeMismatchException if the values have attributes not declared by this
     * @throws NoMatchingParentSpanException if this is attached and depends on a layer which has no matching span
     * @throws NoMatchingEnvelopedSpanException if this is attached and a child of the span is not a span of the enveloped layer
     */
    public AnnotatedSpan addSpan(Span span, Map<String, ?> values) {
        Objects.requireNonNull(span, "Span cannot be null");
        requireKind(span);
        Annotation annotation = toAnnotation(values);
        if (text != null)
            requireAligned(span);

        int index = indexOf(span);
        if (index >= 0) {
            AnnotatedSpan existing = spans.get(index);
            if ( ! ambiguous)
                throw new DuplicateSpanException("Layer '" + name + "' already has a span at " + span +
                                                 " and is not ambiguous");
            if ( ! existing.children().equals(span.children()))
                throw new DuplicateSpanException("Layer '" + name + "' already has a span at " + span +
                                                 " with different children");
            existing.addAnnotation(annotation);
            return existing;
        }
        AnnotatedSpan added = new AnnotatedSpan(this, span, List.of(annotation));
        spans.add(-index - 1, added);
        return added;
    }

    /**
     * Adds an annotation at the location enveloping the given children.
     *
     * @throws NonContiguousChildrenException if the children are not ordered and non-overlapping
     * @throws IllegalArgumentException if this is not an enveloping layer
     * @see #addSpan(Span, Map)
     */
    public AnnotatedSpan addEnvelopingSpan(List<? extends Span> children, Map<String, ?> values) {
        if (topology.kind() != Topology.Kind.ENVELOPING)
            throw new IllegalArgumentException("Layer '" + name + "' is " + topology + ", not enveloping");
        return addSpan(EnvelopingSpan.of(children), values);
    }

    /**
     * Adds the annotations described by the given records to this. Each record holds the location
     * of the span as integer values of the keys "start" and "end", and the attribute values of the annotation.
     * This is equivalent to adding each record with {@link #addSpan} but sorts all records once.
     *
     * @return this for chaining
     */
    public Layer fromRecords(List<? extends Map<String, ?>> records) {
        if (topology.kind() == Topology.Kind.ENVELOPING)
            throw new IllegalArgumentException("Records cannot describe the spans of enveloping layer '" + name + "'");
        List<Located> located = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            Map<String, Object> values = new LinkedHashMap<>(record);
            Span span = Span.of(intValue(values.remove("start")), intValue(values.remove("end")));
            located.add(new Located(span, toAnnotation(values)));
        }
        if ( ! spans.isEmpty()) {
            for (Located record : located)
                addSpan(record.span, record.annotation.asMap());
            return this;
        }

        located.sort(Comparator.comparing(record -> record.span)); // stable: keeps the order of annotations at a location
        if (text != null)
            for (Located record : located)
                requireAligned(record.span);
        List<AnnotatedSpan> built = new ArrayList<>();
        for (Located record : located) {
            AnnotatedSpan last = built.isEmpty() ? null : built.get(built.size() - 1);
            if (last != null && last.span().equals(record.span)) {
                if ( ! ambiguous)
                    throw new DuplicateSpanException("Layer '" + name + "' is not ambiguous but has two records at " + record.span);
                last.addAnnotation(record.annotation);
            }
            else {
                built.add(new AnnotatedSpan(this, record.span, List.of(record.annotation)));
            }
        }
        spans = built;
        return this;
    }

    /**
     * Adds the annotations described by the given groups of records to this ambiguous layer.
     * Each group holds the alternative annotations of one location.
     *
     * @return this for chaining
     * @see #fromRecords(List)
     */
    public Layer fromAmbiguousRecords(List<? extends List<? extends Map<String, ?>>> groups) {
        if ( ! ambiguous)
            throw new IllegalArgumentException("Layer '" + name + "' is not ambiguous");
        List<Map<String, ?>> records = new ArrayList<>();
        for (List<? extends Map<String, ?>> group : groups)
            records.addAll(group);
        return fromRecords(records);
    }

    private static int intValue(Object value) {
        if ( ! (value instanceof Integer || value instanceof Long || value instanceof Short))
            throw new IllegalArgumentException("Records must have integer 'start' and 'end' values, got " + value);
        return Math.toIntExact(((Number)value).longValue());
    }

    // ---------------- Reading spans

    public int size() { return spans.size(); }

    public boolean isEmpty() { return spans.isEmpty(); }

    /** Returns the span at the given index */
    public AnnotatedSpan get(int index) { return spans.get(index); }

    @Override
    public Iterator<AnnotatedSpan> iterator() {
        return Collections.unmodifiableList(spans).iterator();
    }

    /** Returns a snapshot of all the spans of this */
    public SpanList spans() { return new SpanList(this, spans); }

    /** Returns the span at the location of the given span, if any */
    public Optional<AnnotatedSpan> find(Span location) {
        int index = indexOf(location);
        return index >= 0 ? Optional.of(spans.get(index)) : Optional.empty();
    }

    /** Returns the span at the given location, if any */
    public Optional<AnnotatedSpan> find(int start, int end) {
        return find(Span.of(start, end));
    }

    /** Returns whether some span of this covers the given span */
    public boolean hasSpanCovering(Span span) {
        int index = indexOf(span);
        if (index >= 0) return true;
        int insertion = -index - 1;
        for (int i = insertion; i < spans.size() && spans.get(i).start() == span.start(); i++)
            if (spans.get(i).span().covers(span))
                return true;
        for (int i = insertion - 1; i >= 0; i--)
            if (spans.get(i).span().covers(span))
                return true;
        return false;
    }

    /** Same as {@code spans().slice(from, to)} */
    public SpanList slice(int from, int to) { return spans().slice(from, to); }

    /** Same as {@code spans().slice(from, to, step)} */
    public SpanList slice(int from, int to, int step) { return spans().slice(from, to, step); }

    /** Same as {@code spans().select(predicate)} */
    public SpanList select(Predicate<? super AnnotatedSpan> predicate) { return spans().select(predicate); }

    /** Same as {@code spans().select(mask)} */
    public SpanList select(boolean ... mask) { return spans().select(mask); }

    /** Same as {@code spans().select(indexes)} */
    public SpanList select(int ... indexes) { return spans().select(indexes); }

    /** Same as {@code spans().values(attribute)} */
    public List<Object> values(String attribute) { return spans().values(attribute); }

    /** Same as {@code spans().values(attribute, type)} */
    public <T> List<T> values(String attribute, Class<T> type) { return spans().values(attribute, type); }

    /** Same as {@code spans().ambiguousValues(attribute)} */
    public List<List<Object>> ambiguousValues(String attribute) { return spans().ambiguousValues(attribute); }

    /** Same as {@code spans().tuples(attributes)} */
    public List<List<Object>> tuples(String ... attributes) { return spans().tuples(attributes); }

    /** Returns the text of each span. Throws {@link UnboundException} if this is not attached to a text. */
    public List<String> text() { return spans().text(); }

    /** Returns the texts of each span: one per child for enveloping spans */
    public List<List<String>> texts() { return spans().texts(); }

    /**
     * Returns the number of times each value of the given attribute occurs in the annotations of this,
     * in the order values are first encountered.
     */
    public Map<Object, Integer> countValues(String attribute) {
        requireAttribute(attribute);
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (AnnotatedSpan span : spans)
            for (Annotation annotation : span.annotations())
                counts.merge(annotation.get(attribute), 1, Integer::sum);
        return Collections.unmodifiableMap(counts);
    }

    // ---------------- Consistency and rewriting

    /**
     * Verifies every invariant of this layer: span order and uniqueness, the kind of the spans, that every
     * annotation has exactly the declared attributes, and, if this is attached, that all spans fit the text
     * and the layer this depends on. This has no side effects.
     *
     * @throws ConsistencyException describing the first violation found
     */
    public void checkSpanConsistency() {
        SpanConsistency.audit(this, spans, text);
    }

    /**
     * Rewrites the spans of this. The given function receives a private copy of the spans which it may modify
     * freely. The result is audited as by {@link #checkSpanConsistency} and then replaces the spans of this.
     * If this is attached, the layers depending on this are audited against the result as well.
     * Readers never observe a partially rewritten layer: if any audit fails, this is left unchanged.
     *
     * @throws ConsistencyException if the rewritten spans violate an invariant
     */
    public void retag(Consumer<SpanStorage> rewrite) {
        List<AnnotatedSpan> copy = new ArrayList<>(spans.size());
        for (AnnotatedSpan span : spans)
            copy.add(span.copyTo(this));
        SpanStorage storage = new SpanStorage(this, copy);
        rewrite.accept(storage);

        List<AnnotatedSpan> rewritten = storage.contents();
        SpanConsistency.audit(this, rewritten, text);
        List<AnnotatedSpan> previous = spans;
        spans = rewritten;
        if (text != null) {
            try {
                for (Layer dependent : text.directDependentsOf(name))
                    dependent.checkSpanConsistency();
            }
            catch (ConsistencyException e) {
                spans = previous;
                throw e;
            }
        }
        log.log(Level.FINE, () -> "Retagged layer '" + name + "': " + previous.size() + " -> " + spans.size() + " spans");
    }

    /** Returns an unattached copy of this with the same schema and no spans */
    public Layer emptyCopy() {
        return new Builder(this).build();
    }

    /** Returns an unattached copy of this with the same schema and spans */
    public Layer copy() {
        Layer copy = emptyCopy();
        for (AnnotatedSpan span : spans)
            copy.spans.add(span.copyTo(copy));
        return copy;
    }

    // ---------------- Internals

    void requireAttribute(String attribute) {
        if ( ! attributes.contains(attribute))
            throw new UnknownAttributeException("Layer '" + name + "' has no attribute '" + attribute +
                                                "', attributes are " + attributes);
    }

    /** Returns an annotation of the given values, in attribute order, with defaults for values not given */
    Annotation toAnnotation(Map<String, ?> values) {
        for (String attribute : values.keySet())
            if ( ! attributes.contains(attribute))
                throw new AttributeMismatchException("Layer '" + name + "' has no attribute '" + attribute +
                                                     "', attributes are " + attributes);
        Map<String, Object> complete = new LinkedHashMap<>();
        for (String attribute : attributes)
            complete.put(attribute, values.containsKey(attribute) ? values.get(attribute) : defaults.get(attribute));
        return Annotation.of(complete);
    }

    private void requireKind(Span span) {
        switch (topology.kind()) {
            case ENVELOPING:
                if ( ! span.isEnveloping())
                    throw new IllegalArgumentException("Layer '" + name + "' is enveloping: add spans with addEnvelopingSpan");
                break;
            case INDEPENDENT:
            case FRAGMENT:
                if (span.isEnveloping())
                    throw new IllegalArgumentException("Layer '" + name + "' is " + topology + " and cannot hold enveloping spans");
                break;
            case PARENT:
                break;
        }
    }

    /**
     * Throws if the given span does not fit the text this is attached to:
     * the dependency error if it does not fit the layer this depends on.
     */
    void requireAligned(Span span) {
        if (span.end() > text.text().length())
            throw new InvalidRangeException("Span " + span + " of layer '" + name + "' ends after the end of the text, of length " +
                                            text.text().length());
        if ( ! topology.isDependent()) return;
        String reference = topology.reference().get();
        if ( ! text.hasLayer(reference))
            throw new MissingDependencyException("Layer '" + name + "' depends on layer '" + reference +
                                                 "' which is not in the text");
        requireAligned(List.of(new AnnotatedSpan(this, span, List.of())), text.layer(reference));
    }

    /** Throws the dependency error for the first of the given spans which does not fit the given dependency */
    void requireAligned(List<AnnotatedSpan> spans, Layer dependency) {
        Optional<SpanConsistency.Misalignment> misalignment = SpanConsistency.misalignment(this, spans, dependency);
        if (misalignment.isEmpty()) return;
        String message = "Layer '" + name + "': " + misalignment.get().message();
        if (topology.kind() == Topology.Kind.ENVELOPING)
            throw new NoMatchingEnvelopedSpanException(message);
        throw new NoMatchingParentSpanException(message);
    }

    List<AnnotatedSpan> spanList() { return spans; }

    void bind(Text text) {
        if (this.text != null)
            throw new IllegalStateException("Layer '" + name + "' is already attached to a text");
        this.text = text;
    }

    void unbind() {
        this.text = null;
        this.foreignAttributes = Map.of();
    }

    void setForeignAttributes(Map<String, String> foreignAttributes) {
        this.foreignAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(foreignAttributes));
    }

    /** Binary search for the location of the given span: its index if present, (-insertion point - 1) otherwise */
    private int indexOf(Span location) {
        int low = 0;
        int high = spans.size() - 1;
        while (low <= high) {
            int middle = (low + high) >>> 1;
            int order = spans.get(middle).span().compareTo(location);
            if (order < 0)
                low = middle + 1;
            else if (order > 0)
                high = middle - 1;
            else
                return middle;
        }
        return -(low + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof Layer other)) return false;
        return name.equals(other.name) &&
               attributes.equals(other.attributes) &&
               defaults.equals(other.defaults) &&
               ambiguous == other.ambiguous &&
               topology.equals(other.topology) &&
               spans.equals(other.spans);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, ambiguous, topology, spans);
    }

    @Override
    public String toString() {
        return "Layer(name=" + name + ", attributes=" + attributes + ", " + topology +
               (ambiguous ? ", ambiguous" : "") + ", spans=" + spans.size() + ")";
    }

    private static final class Located {

        final Span span;
        final Annotation annotation;

        Located(Span span, Annotation annotation) {
            this.span = span;
            this.annotation = annotation;
        }

    }

    /** Builds the schema of a layer. */
    public static class Builder {

        private final String name;
        private final List<String> attributes = new ArrayList<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private boolean ambiguous = false;
        private Topology topology = Topology.independent();

        public Builder(String name) {
            this.name = name;
        }

        /** Creates a builder of a layer with the schema of the given layer */
        public Builder(Layer layer) {
            this.name = layer.name;
            this.attributes.addAll(layer.attributes);
            this.defaults.putAll(layer.defaults);
            this.ambiguous = layer.ambiguous;
            this.topology = layer.topology;
        }

        public Builder attributes(String ... attributes) {
            return attributes(List.of(attributes));
        }

        public Builder attributes(List<String> attributes) {
            this.attributes.addAll(attributes);
            return this;
        }

        /** Sets the value an attribute gets when it is not given explicitly. This is null if not set. */
        public Builder defaultValue(String attribute, Object value) {
            defaults.put(attribute, value);
            return this;
        }

        public Builder ambiguous(boolean ambiguous) {
            this.ambiguous = ambiguous;
            return this;
        }

        public Builder topology(Topology topology) {
            this.topology = Objects.requireNonNull(topology);
            return this;
        }

        public Builder parent(String layer) { return topology(Topology.parent(layer)); }

        public Builder enveloping(String layer) { return topology(Topology.enveloping(layer)); }

        public Builder fragmentOf(String layer) { return topology(Topology.fragmentOf(layer)); }

        public Layer build() {
            return new Layer(this);
        }

    }

}
