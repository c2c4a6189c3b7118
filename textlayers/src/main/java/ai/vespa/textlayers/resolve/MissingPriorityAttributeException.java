// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.resolve;

import ai.vespa.textlayers.TextLayerException;

/**
 * Thrown when a candidate span to resolve conflicts among has no value of the priority attribute.
 */
public class MissingPriorityAttributeException extends TextLayerException {

    public MissingPriorityAttributeException(String message) {
        super(message);
    }

}
