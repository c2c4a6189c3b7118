// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the invariants of a sequence of spans against the schema of the layer owning them.
 *
 * @see Layer#checkSpanConsistency()
 */
final class SpanConsistency {

    private SpanConsistency() {}

    /**
     * Verifies that the given spans may be the spans of the given layer, and, if a text is given,
     * that they fit the text and the layer this depends on in it.
     *
     * @throws ConsistencyException describing the first violation found
     */
    static void audit(Layer layer, List<AnnotatedSpan> spans, Text text) {
        Set<String> declared = new HashSet<>(layer.attributeNames());
        AnnotatedSpan previous = null;
        for (AnnotatedSpan span : spans) {
            if (span == null)
                throw new ConsistencyException(layer.name(), "Contains a null span");
            if (span.layer() != layer)
                throw new ConsistencyException(layer.name(), span.span(),
                                               "Span belongs to layer '" + span.layer().name() + "'");
            auditKind(layer, span);
            auditAnnotations(layer, span, declared);
            if (previous != null) {
                int order = previous.span().compareTo(span.span());
                if (order == 0)
                    throw new ConsistencyException(layer.name(), span.span(), "Duplicate span location");
                if (order > 0)
                    throw new ConsistencyException(layer.name(), span.span(),
                                                   "Span is not ordered after " + previous.span());
            }
            if (text != null && span.end() > text.text().length())
                throw new ConsistencyException(layer.name(), span.span(),
                                               "Span ends after the end of the text, of length " + text.text().length());
            previous = span;
        }
        if (text != null && layer.topology().isDependent()) {
            String reference = layer.topology().reference().get();
            if ( ! text.hasLayer(reference))
                throw new ConsistencyException(layer.name(), "Depends on layer '" + reference + "' which is not in the text");
            Optional<Misalignment> misalignment = misalignment(layer, spans, text.layer(reference));
            if (misalignment.isPresent())
                throw new ConsistencyException(layer.name(), misalignment.get().span(), misalignment.get().message());
        }
    }

    private static void auditKind(Layer layer, AnnotatedSpan span) {
        switch (layer.topology().kind()) {
            case ENVELOPING:
                if ( ! span.isEnveloping())
                    throw new ConsistencyException(layer.name(), span.span(), "Elementary span in an enveloping layer");
                break;
            case INDEPENDENT:
            case FRAGMENT:
                if (span.isEnveloping())
                    throw new ConsistencyException(layer.name(), span.span(), "Enveloping span in a " +
                                                   layer.topology().kind().name().toLowerCase() + " layer");
                break;
            case PARENT:
                break;
        }
    }

    private static void auditAnnotations(Layer layer, AnnotatedSpan span, Set<String> declared) {
        List<Annotation> annotations = span.annotations();
        if (annotations.isEmpty())
            throw new ConsistencyException(layer.name(), span.span(), "Span has no annotations");
        if ( ! layer.isAmbiguous() && annotations.size() > 1)
            throw new ConsistencyException(layer.name(), span.span(),
                                           annotations.size() + " annotations in a span of an unambiguous layer");
        for (Annotation annotation : annotations) {
            if (annotation == null)
                throw new ConsistencyException(layer.name(), span.span(), "Null annotation");
            Set<String> missing = new HashSet<>(declared);
            missing.removeAll(annotation.attributeNames());
            if ( ! missing.isEmpty())
                throw new ConsistencyException(layer.name(), span.span(), "Annotation " + annotation +
                                               " is missing attributes " + missing);
            Set<String> redundant = new HashSet<>(annotation.attributeNames());
            redundant.removeAll(declared);
            if ( ! redundant.isEmpty())
                throw new ConsistencyException(layer.name(), span.span(), "Annotation " + annotation +
                                               " has undeclared attributes " + redundant);
        }
    }

    /** Returns the first span which does not fit the layer it depends on, if any */
    static Optional<Misalignment> misalignment(Layer layer, List<AnnotatedSpan> spans, Layer dependency) {
        for (AnnotatedSpan span : spans) {
            Optional<String> problem = misalignment(layer.topology().kind(), span.span(), dependency);
            if (problem.isPresent())
                return Optional.of(new Misalignment(span.span(), problem.get()));
        }
        return Optional.empty();
    }

    private static Optional<String> misalignment(Topology.Kind kind, Span span, Layer dependency) {
        switch (kind) {
            case PARENT:
                if ( ! hasSpanLike(dependency, span))
                    return Optional.of("No span " + span + " in parent layer '" + dependency.name() + "'");
                return Optional.empty();
            case ENVELOPING:
                for (Span child : span.children()) {
                    if ( ! hasSpanLike(dependency, child))
                        return Optional.of("Child " + child + " is not a span of enveloped layer '" + dependency.name() + "'");
                }
                return Optional.empty();
            case FRAGMENT:
                if ( ! dependency.hasSpanCovering(span))
                    return Optional.of("No span of layer '" + dependency.name() + "' covers " + span);
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static boolean hasSpanLike(Layer layer, Span span) {
        return layer.find(span).map(found -> found.children().equals(span.children())).orElse(false);
    }

    static final class Misalignment {

        private final Span span;
        private final String message;

        Misalignment(Span span, String message) {
            this.span = span;
            this.message = message;
        }

        Span span() { return span; }

        String message() { return message; }

    }

}
