// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a span location is added twice to a layer which is not ambiguous.
 */
public class DuplicateSpanException extends SchemaException {

    public DuplicateSpanException(String message) {
        super(message);
    }

}
