// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * A span composed of an ordered sequence of non-overlapping child spans. The span extends from the start of
 * the first child to the end of the last. Gaps between children are allowed.
 */
public final class EnvelopingSpan extends Span {

    private final ImmutableList<Span> children;

    private EnvelopingSpan(ImmutableList<Span> children) {
        super(children.get(0).start(), children.get(children.size() - 1).end());
        this.children = children;
    }

    /**
     * Creates an enveloping span of the given children.
     *
     * @throws NonContiguousChildrenException if there are no children, or some child does not start
     *         at or after the end of the preceding one
     */
    public static EnvelopingSpan of(List<? extends Span> children) {
        if (children.isEmpty())
            throw new NonContiguousChildrenException("An enveloping span must have at least one child");
        Span previous = null;
        for (Span child : children) {
            if (previous != null && child.start() < previous.end())
                throw new NonContiguousChildrenException("Child " + child + " does not follow " + previous +
                                                         ": children must be ordered and non-overlapping");
            previous = child;
        }
        return new EnvelopingSpan(ImmutableList.copyOf(children));
    }

    @Override
    public boolean isEnveloping() { return true; }

    @Override
    public List<Span> children() { return children; }

    @Override
    List<String> texts(String text) {
        List<String> texts = new ArrayList<>(children.size());
        for (Span child : children)
            texts.add(text.substring(child.start(), child.end()));
        return texts;
    }

}
