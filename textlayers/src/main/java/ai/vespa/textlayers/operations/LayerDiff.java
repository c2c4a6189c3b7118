// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.operations;

import ai.vespa.textlayers.Span;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The differences between the spans of two layers: the locations present in only one of them,
 * and the locations present in both where the spans differ in children or annotations.
 */
public final class LayerDiff {

    private final String nameA;
    private final String nameB;
    private final List<Span> onlyInA;
    private final List<Span> onlyInB;
    private final List<Span> changed;

    LayerDiff(String nameA, String nameB, List<Span> onlyInA, List<Span> onlyInB, List<Span> changed) {
        this.nameA = nameA;
        this.nameB = nameB;
        this.onlyInA = ImmutableList.copyOf(onlyInA);
        this.onlyInB = ImmutableList.copyOf(onlyInB);
        this.changed = ImmutableList.copyOf(changed);
    }

    /** Returns the locations of the first layer which are not in the second, in order */
    public List<Span> onlyInA() { return onlyInA; }

    /** Returns the locations of the second layer which are not in the first, in order */
    public List<Span> onlyInB() { return onlyInB; }

    /** Returns the locations in both layers where the spans are not equal, in order */
    public List<Span> changed() { return changed; }

    /** Returns whether the layers have equal spans */
    public boolean isEmpty() {
        return onlyInA.isEmpty() && onlyInB.isEmpty() && changed.isEmpty();
    }

    @Override
    public String toString() {
        if (isEmpty()) return "no differences between '" + nameA + "' and '" + nameB + "'";
        return "differences between '" + nameA + "' and '" + nameB + "': only in '" + nameA + "': " + onlyInA +
               ", only in '" + nameB + "': " + onlyInB + ", changed: " + changed;
    }

}
