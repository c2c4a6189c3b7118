// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Superclass of the errors raised by the layered text model. These are programmer or data errors
 * and are never retried or repaired by the model itself.
 */
public abstract class TextLayerException extends RuntimeException {

    protected TextLayerException(String message) {
        super(message);
    }

    protected TextLayerException(String message, Throwable cause) {
        super(message, cause);
    }

}
