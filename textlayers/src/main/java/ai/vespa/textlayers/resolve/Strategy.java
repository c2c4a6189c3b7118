// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.resolve;

/**
 * How a {@link ConflictResolver} chooses among overlapping candidate spans.
 * Candidates with a better (lower) priority always win over overlapping candidates with a worse one.
 */
public enum Strategy {

    /** Among overlapping candidates of equal priority, the longest wins */
    MAX,

    /** Among overlapping candidates of equal priority, the shortest wins */
    MIN,

    /** Overlapping candidates of equal priority are all kept: only a better priority excludes a candidate */
    ALL;

    /** Returns the strategy of the given name, ignoring case */
    public static Strategy fromName(String name) {
        for (Strategy strategy : values())
            if (strategy.name().equalsIgnoreCase(name))
                return strategy;
        throw new IllegalArgumentException("Unknown conflict resolving strategy '" + name + "', must be one of MAX, MIN, ALL");
    }

}
