// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.resolve;

import java.util.Objects;

/**
 * Immutable settings of a {@link ConflictResolver}.
 */
public final class ConflictResolverConfig {

    public static final String defaultPriorityAttribute = "_priority_";

    private static final ConflictResolverConfig defaults = new Builder().build();

    private final Strategy strategy;
    private final String priorityAttribute;
    private final boolean keepEqual;

    private ConflictResolverConfig(Builder builder) {
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy cannot be null");
        this.priorityAttribute = Objects.requireNonNull(builder.priorityAttribute, "priorityAttribute cannot be null");
        if (priorityAttribute.isEmpty())
            throw new IllegalArgumentException("priorityAttribute cannot be empty");
        this.keepEqual = builder.keepEqual;
    }

    /** Returns the config with the default strategy MAX, priority attribute "_priority_", and keepEqual set */
    public static ConflictResolverConfig defaults() { return defaults; }

    public Strategy strategy() { return strategy; }

    /** Returns the name of the attribute holding the priority of each annotation */
    public String priorityAttribute() { return priorityAttribute; }

    /**
     * Returns whether candidates at the same location with the same priority are kept together,
     * as alternatives rather than conflicts
     */
    public boolean keepEqual() { return keepEqual; }

    public Builder toBuilder() {
        return new Builder().strategy(strategy).priorityAttribute(priorityAttribute).keepEqual(keepEqual);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof ConflictResolverConfig other)) return false;
        return strategy == other.strategy && priorityAttribute.equals(other.priorityAttribute) && keepEqual == other.keepEqual;
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, priorityAttribute, keepEqual);
    }

    @Override
    public String toString() {
        return "conflict resolver config: strategy " + strategy + ", priority attribute '" + priorityAttribute +
               "', keep equal " + keepEqual;
    }

    public static class Builder {

        private Strategy strategy = Strategy.MAX;
        private String priorityAttribute = defaultPriorityAttribute;
        private boolean keepEqual = true;

        public Builder strategy(Strategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder priorityAttribute(String priorityAttribute) {
            this.priorityAttribute = priorityAttribute;
            return this;
        }

        public Builder keepEqual(boolean keepEqual) {
            this.keepEqual = keepEqual;
            return this;
        }

        public ConflictResolverConfig build() {
            return new ConflictResolverConfig(this);
        }

    }

}
