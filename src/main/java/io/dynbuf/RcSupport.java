/*
 * Copyright 2020 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.dynbuf;

import io.netty.util.IllegalReferenceCountException;

import java.lang.invoke.VarHandle;

import static io.dynbuf.internal.Statics.findVarHandle;
import static java.lang.invoke.MethodHandles.lookup;

public abstract class RcSupport<I extends Rc<I>, T extends RcSupport<I, T>> implements Rc<I> {
    private static final VarHandle REF_COUNT = findVarHandle(lookup(), RcSupport.class, "refCount", int.class);
    @SuppressWarnings("FieldMayBeFinal")
    private volatile int refCount; // Dropped if zero. Updated via VarHandle.
    private final Drop<T> drop;
    private final LifecycleTracer tracer;

    protected RcSupport(Drop<T> drop) {
        this.drop = drop;
        refCount = 1;
        tracer = LifecycleTracer.get();
    }

    /**
     * Increment the reference count.
     * <p>
     * The increment is atomic, but nothing else about this object is made thread-safe by it.
     *
     * @return This Rc instance.
     */
    @Override
    public final I retain() {
        int c;
        do {
            c = refCount;
            if (c == 0) {
                throw attachTrace(new IllegalReferenceCountException(0, 1));
            }
            if (c == Integer.MAX_VALUE) {
                throw new IllegalReferenceCountException(c, 1);
            }
        } while (!REF_COUNT.compareAndSet(this, c, c + 1));
        tracer.retain(c + 1);
        return self();
    }

    /**
     * Decrement the reference count, and dispose of the resource if the last reference is released.
     *
     * @throws IllegalReferenceCountException If this Rc has already been dropped.
     */
    @Override
    public final void release() {
        int c;
        do {
            c = refCount;
            if (c == 0) {
                throw attachTrace(new IllegalReferenceCountException(0, -1));
            }
        } while (!REF_COUNT.compareAndSet(this, c, c - 1));
        if (c == 1) {
            tracer.drop();
            drop.drop(impl());
        } else {
            tracer.release(c - 1);
        }
    }

    @Override
    public final int refCount() {
        return refCount;
    }

    @Override
    public boolean isOwned() {
        return refCount == 1;
    }

    @Override
    public boolean isAccessible() {
        return refCount > 0;
    }

    /**
     * Record a custom lifecycle event, such as the creation of a slice, in the lifecycle trace of this object.
     *
     * @param event The name of the event.
     */
    protected void trace(String event) {
        tracer.event(event, refCount);
    }

    /**
     * Attach a trace of the life-cycle of this object as suppressed exceptions to the given throwable.
     *
     * @param throwable The throwable to attach a life-cycle trace to.
     * @param <E> The concrete exception type.
     * @return The given exception, which can then be thrown.
     */
    protected <E extends Throwable> E attachTrace(E throwable) {
        return tracer.attachTrace(throwable);
    }

    /**
     * Get access to the underlying {@link Drop} object.
     *
     * @return The {@link Drop} object used by this reference counted object.
     */
    protected Drop<T> unsafeGetDrop() {
        return drop;
    }

    @SuppressWarnings("unchecked")
    private I self() {
        return (I) this;
    }

    @SuppressWarnings("unchecked")
    private T impl() {
        return (T) this;
    }
}
