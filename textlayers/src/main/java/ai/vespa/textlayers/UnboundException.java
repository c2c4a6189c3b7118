// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when text is requested from a span or layer which is not attached to a text.
 */
public class UnboundException extends TextLayerException {

    public UnboundException(String message) {
        super(message);
    }

}
