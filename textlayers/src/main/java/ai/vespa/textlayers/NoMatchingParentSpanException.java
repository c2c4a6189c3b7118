// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a span of a parent-attached or fragment layer has no matching span in the layer it depends on.
 */
public class NoMatchingParentSpanException extends DependencyException {

    public NoMatchingParentSpanException(String message) {
        super(message);
    }

}
