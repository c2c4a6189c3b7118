// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when the children of an enveloping span are empty, out of order or overlapping.
 */
public class NonContiguousChildrenException extends SchemaException {

    public NonContiguousChildrenException(String message) {
        super(message);
    }

}
