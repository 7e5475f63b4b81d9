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

import io.dynbuf.internal.Statics;
import io.netty.util.internal.SystemPropertyUtil;

import java.util.Arrays;
import java.util.List;

/**
 * Interface for {@link Buffer} allocators.
 */
public interface BufferAllocator extends AutoCloseable {
    /**
     * The largest capacity a buffer can have.
     */
    int MAX_CAPACITY = Statics.MAX_CAPACITY;

    /**
     * Check that the given {@code size} argument is a valid buffer size, or throw an {@link IllegalArgumentException}.
     *
     * @param size The size to check.
     * @throws IllegalArgumentException if the size is negative, or if the size is too big (over ~2 GB) for a
     * buffer to accommodate.
     */
    static void checkSize(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("Buffer size cannot be negative, but was " + size + '.');
        }
        if (size > MAX_CAPACITY) {
            throw new IllegalArgumentException(
                    "Buffer size cannot be greater than " + MAX_CAPACITY + ", but was " + size + '.');
        }
    }

    /**
     * Allocate an empty {@link Buffer} with the given capacity in bytes.
     * This method may throw an {@link OutOfMemoryError} if there is not enough free memory available.
     *
     * @param capacity The capacity of the {@link Buffer} to allocate. Zero is allowed.
     * @return The newly allocated {@link Buffer}, with a size of zero and a reference count of one.
     */
    Buffer allocate(int capacity);

    /**
     * Allocate a {@link Buffer} holding a copy of the given bytes, with a capacity equal to their length.
     *
     * @param data The bytes to copy. May be {@code null} if {@code length} is zero.
     * @param offset The offset of the first byte to copy.
     * @param length The number of bytes to copy.
     * @return The newly allocated {@link Buffer}.
     */
    Buffer copyOf(byte[] data, int offset, int length);

    default Buffer copyOf(byte[] data) {
        return data == null? allocate(0) : copyOf(data, 0, data.length);
    }

    /**
     * Create a {@link Buffer} that takes ownership of the given array, without copying it.
     * The capacity of the buffer is the length of the array, and the first {@code size} bytes are its contents.
     * <p>
     * The caller must not access the array after handing it over.
     *
     * @param memory The array to adopt.
     * @param size The number of valid bytes in the array.
     * @return The new {@link Buffer}, or {@code null} if the size is negative or greater than the array length.
     */
    Buffer adopt(byte[] memory, int size);

    /**
     * Allocate a new buffer holding the bytes of the first buffer followed by the bytes of the second.
     *
     * @param first The first buffer, or {@code null} for none.
     * @param second The second buffer, or {@code null} for none.
     * @return A new buffer of exactly the combined size.
     */
    default Buffer concat(Buffer first, Buffer second) {
        return concat(Arrays.asList(first, second));
    }

    default Buffer concat(Buffer... buffers) {
        return buffers == null? allocate(0) : concat(Arrays.asList(buffers));
    }

    /**
     * Allocate a new buffer holding the bytes of all the given buffers, in order.
     * {@code null} elements count as empty buffers.
     *
     * @param buffers The buffers to concatenate.
     * @return A new buffer of exactly the combined size.
     * @throws IllegalArgumentException if the combined size is greater than {@link #MAX_CAPACITY}.
     */
    default Buffer concat(List<? extends Buffer> buffers) {
        if (buffers == null || buffers.isEmpty()) {
            return allocate(0);
        }
        long total = 0;
        for (Buffer buffer : buffers) {
            if (buffer != null) {
                total += buffer.size();
            }
        }
        checkSize(total);
        byte[] memory = new byte[(int) total];
        int position = 0;
        for (Buffer buffer : buffers) {
            if (buffer != null) {
                int size = buffer.size();
                buffer.copyInto(0, memory, position, size);
                position += size;
            }
        }
        return adopt(memory, memory.length);
    }

    /**
     * Close this allocator, freeing all of its internal resources. Buffers already allocated are not affected.
     */
    @Override
    default void close() {
    }

    /**
     * The default allocator. Leak detection is enabled if the {@code io.dynbuf.leakDetection} system property is
     * {@code true}.
     */
    static BufferAllocator heap() {
        return new ManagedBufferAllocator(SystemPropertyUtil.getBoolean("io.dynbuf.leakDetection", false));
    }

    /**
     * An allocator that logs a warning for every buffer that is garbage collected before being released.
     */
    static BufferAllocator leakDetectingHeap() {
        return new ManagedBufferAllocator(true);
    }
}
