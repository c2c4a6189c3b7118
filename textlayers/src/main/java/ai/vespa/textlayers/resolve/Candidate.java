// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.resolve;

import ai.vespa.textlayers.Span;

import java.util.Objects;

/**
 * A span competing for a place in the result of a conflict resolution, with its priority
 * (lower is better) and an arbitrary payload carried along to the result.
 */
public record Candidate<T>(Span span, double priority, T payload) {

    public Candidate {
        Objects.requireNonNull(span, "span cannot be null");
        if (Double.isNaN(priority))
            throw new IllegalArgumentException("Priority of " + span + " is not a number");
    }

    public static Candidate<Void> of(int start, int end, double priority) {
        return new Candidate<>(Span.of(start, end), priority, null);
    }

}
