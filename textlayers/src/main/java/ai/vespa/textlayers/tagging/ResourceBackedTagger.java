// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import java.util.List;

/**
 * A tagger using a shared tool resource. The tagger holds a reference to the resource from
 * construction until it is closed.
 */
public abstract class ResourceBackedTagger<RESOURCE extends SharedToolResource> extends Tagger implements AutoCloseable {

    private final RESOURCE resource;
    private final SharedToolResource.Reference reference;
    private boolean closed = false;

    protected ResourceBackedTagger(RESOURCE resource, String outputLayer, List<String> outputAttributes, List<String> inputLayers) {
        super(outputLayer, outputAttributes, inputLayers);
        this.reference = resource.refer();
        this.resource = resource;
    }

    /**
     * Returns the resource of this.
     *
     * @throws IllegalStateException if this is closed
     */
    protected final RESOURCE resource() {
        if (closed) throw new IllegalStateException(this + " is closed");
        return resource;
    }

    /** Releases the reference of this to its resource */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        reference.close();
    }

}
