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

/**
 * An Rc is a reference counted resource of sorts. The reference count is updated atomically, so handles to the
 * same resource may be retained and released from different threads. Nothing else about an Rc is thread-safe.
 * <p>
 * When the last reference is released (accounted for using {@link AutoCloseable} and try-with-resources statements,
 * ideally), then the resource is disposed of. The precise action is implemented by the {@link Drop} instance given
 * as an argument to the Rc constructor.
 *
 * @param <I> The concrete subtype.
 */
public interface Rc<I extends Rc<I>> extends AutoCloseable {
    /**
     * Increment the reference count.
     *
     * @return This Rc instance, for chaining.
     * @throws io.netty.util.IllegalReferenceCountException If this Rc has already been dropped.
     */
    I retain();

    /**
     * Decrement the reference count, and dispose of the resource if the last reference is released.
     * <p>
     * The handle must not be used after this call, unless other references are known to still be outstanding.
     *
     * @throws io.netty.util.IllegalReferenceCountException If this Rc has already been dropped.
     */
    void release();

    /**
     * Same as {@link #release()}, so reference counted objects can be used in try-with-resources statements.
     */
    @Override
    default void close() {
        release();
    }

    /**
     * Get the current reference count.
     *
     * @return The number of live references, or {@code 0} if this object has been dropped.
     */
    int refCount();

    /**
     * Check that this reference counted object is owned, meaning that exactly one reference is outstanding.
     *
     * @return {@code true} if this object has a reference count of exactly one.
     */
    boolean isOwned();

    /**
     * Check if this object is accessible.
     *
     * @return {@code true} if this object is still valid and can be accessed,
     * otherwise {@code false} if, for instance, this object has been dropped.
     */
    boolean isAccessible();
}
