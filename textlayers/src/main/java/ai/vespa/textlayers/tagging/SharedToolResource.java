// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An external tool (an analyzer process, a loaded model, a dictionary) shared by the taggers using it.
 *
 * <p>The creator of a resource holds its first reference and gives it up with {@link #release()}. Each tagger
 * using the resource holds a {@link Reference} obtained from {@link #refer()}, which it closes when done.
 * Once no references remain, {@link #destroy()} is called, exactly once. This class is thread safe.</p>
 */
public abstract class SharedToolResource {

    private static final Logger log = Logger.getLogger(SharedToolResource.class.getName());

    private final Object monitor = new Object();
    private int references = 1;
    private boolean released = false;
    private boolean destroyed = false;

    /**
     * Returns a new reference to this, which must be closed exactly once.
     *
     * @throws IllegalStateException if this is destroyed
     */
    public final Reference refer() {
        synchronized (monitor) {
            if (destroyed)
                throw new IllegalStateException(this + " is destroyed");
            references++;
        }
        return new Reference();
    }

    /**
     * Releases the reference held by the creator of this.
     *
     * @throws IllegalStateException if this is already released
     */
    public final void release() {
        synchronized (monitor) {
            if (released)
                throw new IllegalStateException(this + " is already released");
            released = true;
        }
        decrement();
    }

    /** Returns the current number of references to this */
    public final int retainCount() {
        synchronized (monitor) {
            return references;
        }
    }

    public final boolean isDestroyed() {
        synchronized (monitor) {
            return destroyed;
        }
    }

    /** Frees the tool held by this. Called once, when no references remain. */
    protected void destroy() { }

    private void decrement() {
        synchronized (monitor) {
            if (--references > 0) return;
            destroyed = true;
        }
        log.log(Level.FINE, () -> "Destroying " + this);
        destroy();
    }

    /** A live reference to a shared tool resource. */
    public final class Reference implements AutoCloseable {

        private boolean closed = false;

        private Reference() {}

        /** Returns the referenced resource */
        public SharedToolResource resource() { return SharedToolResource.this; }

        /**
         * Releases this reference.
         *
         * @throws IllegalStateException if this is already closed
         */
        @Override
        public void close() {
            synchronized (monitor) {
                if (closed)
                    throw new IllegalStateException("Reference to " + SharedToolResource.this + " is already closed");
                closed = true;
            }
            decrement();
        }

    }

}
