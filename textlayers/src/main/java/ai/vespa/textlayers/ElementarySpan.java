// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.List;

/**
 * A span which is a plain interval of the text.
 */
public final class ElementarySpan extends Span {

    ElementarySpan(int start, int end) {
        super(start, end);
    }

    @Override
    public boolean isEnveloping() { return false; }

    @Override
    public List<Span> children() { return List.of(); }

    @Override
    List<String> texts(String text) {
        return List.of(text.substring(start(), end()));
    }

}
