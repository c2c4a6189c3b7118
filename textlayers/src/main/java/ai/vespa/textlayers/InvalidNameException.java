// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown on a layer or attribute name which is not a legal identifier of the form [a-zA-Z_][a-zA-Z_0-9]*.
 */
public class InvalidNameException extends SchemaException {

    public InvalidNameException(String message) {
        super(message);
    }

}
