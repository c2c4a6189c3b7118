// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when the attributes given for an annotation are not those declared by its layer.
 */
public class AttributeMismatchException extends SchemaException {

    public AttributeMismatchException(String message) {
        super(message);
    }

}
