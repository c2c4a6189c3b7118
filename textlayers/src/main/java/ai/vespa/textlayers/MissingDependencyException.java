// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a layer this depends on is not present in the text.
 */
public class MissingDependencyException extends DependencyException {

    public MissingDependencyException(String message) {
        super(message);
    }

}
