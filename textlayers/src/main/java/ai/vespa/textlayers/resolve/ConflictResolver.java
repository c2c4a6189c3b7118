// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.resolve;

import ai.vespa.textlayers.AnnotatedSpan;
import ai.vespa.textlayers.Annotation;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selects a coherent subset of overlapping candidate spans by priority and strategy.
 *
 * <p>Candidates are ranked by priority (lower first), then by length (longest first for {@link Strategy#MAX},
 * shortest first for {@link Strategy#MIN}, ignored for {@link Strategy#ALL}), then by start, then by input order.
 * Each candidate in rank order is accepted unless it conflicts with one accepted before it.
 * An accepted candidate conflicts with a later one overlapping it when the strategy is MAX or MIN, and when the
 * later one has a worse priority if the strategy is ALL. Candidates at identical locations with the same priority
 * never conflict when keepEqual is set.</p>
 *
 * <p>The result is sorted by location and then input order. Inputs are never modified.</p>
 */
public final class ConflictResolver {

    private static final Logger log = Logger.getLogger(ConflictResolver.class.getName());

    private final ConflictResolverConfig config;

    public ConflictResolver() {
        this(ConflictResolverConfig.defaults());
    }

    public ConflictResolver(ConflictResolverConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public ConflictResolverConfig config() { return config; }

    /** Resolves conflicts among the spans of the given layer with the config of this */
    public Layer resolve(Layer layer) {
        return resolve(layer, config.strategy(), config.priorityAttribute(), config.keepEqual());
    }

    /** Resolves conflicts among the given candidates with the strategy and keepEqual setting of this */
    public <T> List<Candidate<T>> resolve(List<Candidate<T>> candidates) {
        return resolve(candidates, config.strategy(), config.keepEqual());
    }

    /**
     * Returns the candidates which remain when conflicts between them are resolved.
     *
     * @param candidates the candidates, in any order
     * @param strategy how to choose among overlapping candidates of equal priority
     * @param keepEqual whether candidates at identical locations with equal priority are kept together
     * @return the selected candidates, sorted by location and then input order
     */
    public static <T> List<Candidate<T>> resolve(List<Candidate<T>> candidates, Strategy strategy, boolean keepEqual) {
        List<Ranked<T>> ranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++)
            ranked.add(new Ranked<>(Objects.requireNonNull(candidates.get(i), "Candidates cannot be null"), i));
        ranked.sort(ranking(strategy));

        List<Ranked<T>> accepted = new ArrayList<>();
        for (Ranked<T> candidate : ranked) {
            if (accepted.stream().noneMatch(winner -> conflicts(winner.candidate, candidate.candidate, strategy, keepEqual)))
                accepted.add(candidate);
        }

        accepted.sort(Comparator.<Ranked<T>, Span>comparing(winner -> winner.candidate.span())
                                .thenComparingInt(winner -> winner.order));
        List<Candidate<T>> result = new ArrayList<>(accepted.size());
        for (Ranked<T> candidate : accepted)
            result.add(candidate.candidate);
        return result;
    }

    /**
     * Returns a new, unattached layer with the schema of the given layer, holding the spans which remain when
     * conflicts between its spans are resolved. The priority of a span is the best priority of its annotations.
     * Of each remaining span, only the annotations with that priority are kept, and only the first of them
     * unless keepEqual is set.
     *
     * @throws MissingPriorityAttributeException if the layer does not declare the priority attribute,
     *         or some annotation has no value for it
     * @throws IllegalArgumentException if some priority value is not a number
     */
    public static Layer resolve(Layer layer, Strategy strategy, String priorityAttribute, boolean keepEqual) {
        if ( ! layer.attributeNames().contains(priorityAttribute))
            throw new MissingPriorityAttributeException("Layer '" + layer.name() + "' has no priority attribute '" +
                                                        priorityAttribute + "'");
        List<Candidate<AnnotatedSpan>> candidates = new ArrayList<>(layer.size());
        for (AnnotatedSpan span : layer)
            candidates.add(new Candidate<>(span.span(), bestPriority(span, priorityAttribute), span));

        List<Candidate<AnnotatedSpan>> selected = resolve(candidates, strategy, keepEqual);

        Layer result = layer.emptyCopy();
        for (Candidate<AnnotatedSpan> candidate : selected) {
            for (Annotation annotation : candidate.payload().annotations()) {
                if (priorityOf(annotation, candidate.payload(), priorityAttribute) != candidate.priority()) continue;
                result.addSpan(candidate.span(), annotation.asMap());
                if ( ! keepEqual) break;
            }
        }
        log.log(Level.FINE, () -> "Resolved conflicts in layer '" + layer.name() + "' with " + strategy +
                                  ": kept " + result.size() + " of " + layer.size() + " spans");
        return result;
    }

    private static double bestPriority(AnnotatedSpan span, String priorityAttribute) {
        double best = Double.POSITIVE_INFINITY;
        for (Annotation annotation : span.annotations())
            best = Math.min(best, priorityOf(annotation, span, priorityAttribute));
        return best;
    }

    private static double priorityOf(Annotation annotation, AnnotatedSpan span, String priorityAttribute) {
        Object value = annotation.asMap().get(priorityAttribute);
        if (value == null)
            throw new MissingPriorityAttributeException("No value of priority attribute '" + priorityAttribute +
                                                        "' in " + annotation + " at " + span.span() +
                                                        " of layer '" + span.layer().name() + "'");
        if ( ! (value instanceof Number))
            throw new IllegalArgumentException("Priority '" + value + "' at " + span.span() + " of layer '" +
                                               span.layer().name() + "' is not a number");
        return ((Number)value).doubleValue();
    }

    private static <T> Comparator<Ranked<T>> ranking(Strategy strategy) {
        Comparator<Ranked<T>> byPriority = Comparator.comparingDouble(ranked -> ranked.candidate.priority());
        switch (strategy) {
            case MAX:
                byPriority = byPriority.thenComparing(Comparator.comparingInt((Ranked<T> ranked) -> ranked.candidate.span().length())
                                                                .reversed());
                break;
            case MIN:
                byPriority = byPriority.thenComparingInt(ranked -> ranked.candidate.span().length());
                break;
            case ALL:
                break;
        }
        return byPriority.thenComparingInt((Ranked<T> ranked) -> ranked.candidate.span().start())
                         .thenComparingInt(ranked -> ranked.order);
    }

    /** Returns whether the given candidate must be rejected because the given, already accepted, candidate is kept */
    private static boolean conflicts(Candidate<?> accepted, Candidate<?> candidate, Strategy strategy, boolean keepEqual) {
        if ( ! accepted.span().overlaps(candidate.span())) return false;
        if (accepted.span().equals(candidate.span()) && accepted.priority() == candidate.priority()) return ! keepEqual;
        if (strategy == Strategy.ALL) return candidate.priority() > accepted.priority();
        return true;
    }

    private static final class Ranked<T> {

        final Candidate<T> candidate;
        final int order;

        Ranked(Candidate<T> candidate, int order) {
            this.candidate = candidate;
            this.order = order;
        }

    }

}
