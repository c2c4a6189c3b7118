// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SharedToolResourceTestCase {

    @Test
    void requireThatDestroyIsCalledWhenReleased() {
        MyResource res = new MyResource();
        assertFalse(res.destroyed);
        res.release();
        assertTrue(res.destroyed);
        assertTrue(res.isDestroyed());
    }

    @Test
    void requireThatDestroyIsCalledWhenRetainCountReachesZero() {
        MyResource res = new MyResource();
        assertEquals(1, res.retainCount());
        SharedToolResource.Reference reference = res.refer();
        assertSame(res, reference.resource());
        assertEquals(2, res.retainCount());
        res.release();
        assertEquals(1, res.retainCount());
        assertFalse(res.destroyed);
        reference.close();
        assertEquals(0, res.retainCount());
        assertTrue(res.destroyed);
    }

    @Test
    void requireThatDestroyIsCalledWhenRetainCountReachesZeroOppositeOrder() {
        MyResource res = new MyResource();
        SharedToolResource.Reference reference = res.refer();
        reference.close();
        assertEquals(1, res.retainCount());
        assertFalse(res.destroyed);
        res.release();
        assertEquals(0, res.retainCount());
        assertTrue(res.destroyed);
    }

    @Test
    void requireThatReleaseCanOnlyBeCalledOnce() {
        MyResource res = new MyResource();
        SharedToolResource.Reference reference = res.refer();
        res.release();
        assertThrows(IllegalStateException.class, res::release);
        reference.close();
        assertEquals(1, res.destroyCount);
    }

    @Test
    void requireThatReferencesCanOnlyBeClosedOnce() {
        MyResource res = new MyResource();
        SharedToolResource.Reference reference = res.refer();
        reference.close();
        assertThrows(IllegalStateException.class, reference::close);
        res.release();
        assertEquals(1, res.destroyCount);
    }

    @Test
    void requireThatDestroyedResourcesCannotBeReferred() {
        MyResource res = new MyResource();
        res.release();
        assertThrows(IllegalStateException.class, res::refer);
    }

    @Test
    void requireThatTaggersHoldTheirResourceUntilClosed() {
        MyResource res = new MyResource();
        Text text = new Text("one two");
        try (UppercaseTagger first = new UppercaseTagger(res); UppercaseTagger second = new UppercaseTagger(res)) {
            assertEquals(3, res.retainCount());
            res.release();
            first.tag(text);
            assertEquals(List.of("ONE TWO"), text.layer("upper").values("upper"));
            first.close();
            assertThrows(IllegalStateException.class, () -> first.makeLayer(text));
            assertFalse(res.destroyed);
            assertEquals(1, second.makeLayer(text).size());
        }
        assertTrue(res.destroyed);
        assertEquals(1, res.destroyCount);
    }

    private static class MyResource extends SharedToolResource {

        boolean destroyed = false;
        int destroyCount = 0;

        @Override
        protected void destroy() {
            destroyed = true;
            destroyCount++;
        }

        String uppercase(String text) {
            return text.toUpperCase();
        }

    }

    private static class UppercaseTagger extends ResourceBackedTagger<MyResource> {

        UppercaseTagger(MyResource resource) {
            super(resource, "upper", List.of("upper"), List.of());
        }

        @Override
        protected Layer makeLayer(Text text, Map<String, Layer> inputs) {
            Layer layer = new Layer.Builder(outputLayer()).attributes(outputAttributes()).build();
            layer.addSpan(0, text.text().length(), Map.of("upper", resource().uppercase(text.text())));
            return layer;
        }

    }

}
