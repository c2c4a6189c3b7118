// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a layer does not fit the layer it depends on, or when that layer is not available.
 */
public abstract class DependencyException extends TextLayerException {

    protected DependencyException(String message) {
        super(message);
    }

}
