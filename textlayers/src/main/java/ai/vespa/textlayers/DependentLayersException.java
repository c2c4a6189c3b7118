// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when removing a layer which other layers of the same text still depend on.
 */
public class DependentLayersException extends DependencyException {

    public DependentLayersException(String message) {
        super(message);
    }

}
