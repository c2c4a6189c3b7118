// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a child of an enveloping span is not a span of the enveloped layer.
 */
public class NoMatchingEnvelopedSpanException extends DependencyException {

    public NoMatchingEnvelopedSpanException(String message) {
        super(message);
    }

}
