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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * A reference counted, linear range of bytes, with a size and a capacity.
 *
 * <h3>Creating a buffer</h3>
 *
 * Buffers are created by {@linkplain BufferAllocator allocators}, through their {@code allocate}, {@code copyOf},
 * {@code adopt} and {@code concat} methods, or derived from other buffers with the {@code slice} family of methods.
 *
 * <h3>Life cycle and reference counting</h3>
 *
 * When the buffer is created, its reference count is one, and a pairing {@link #release()} (or {@link #close()})
 * call will deallocate it.
 * In this state, the buffer {@linkplain #isOwned() is "owned"}.
 * <p>
 * The buffer can be {@linkplain #retain() retained} when it is shared with other code.
 * Every retain must be paired with a release.
 * Once the reference count reaches zero, the buffer is dropped and every further access throws.
 *
 * <h3>Slices</h3>
 *
 * A slice is a view onto a region of another buffer's memory; no bytes are copied.
 * The slice holds a reference to the root buffer that owns the memory, so the root is not dropped while any slice
 * is alive.
 * Slices of slices refer directly to the root.
 *
 * <h3>Mutation</h3>
 *
 * The size and contents of a buffer can only be changed in place when the buffer {@linkplain #isWritable() is
 * writable}: it must be owned, and it must not be a slice.
 * Since slices retain their root, a root buffer with live slices is not writable either.
 * Mutating methods return {@code false} when this condition does not hold, and leave the buffer unchanged.
 *
 * <h3>Thread-safety</h3>
 *
 * Only the reference count is updated atomically.
 * Reads and writes of the buffer contents must be externally synchronized if they happen from multiple threads.
 */
public interface Buffer extends Rc<Buffer>, Comparable<Buffer> {
    /**
     * The number of valid bytes in this buffer.
     *
     * @return The size in bytes.
     */
    int size();

    /**
     * The number of bytes this buffer can hold before its memory must grow.
     * Slices always have a capacity equal to their size.
     *
     * @return The capacity in bytes.
     */
    int capacity();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return {@code true} if this buffer is a view onto the memory of another buffer.
     */
    boolean isSlice();

    /**
     * Query if this buffer can be modified in place.
     *
     * @return {@code true} if this buffer is {@linkplain #isOwned() owned} and is not a {@linkplain #isSlice() slice}.
     */
    boolean isWritable();

    byte getByte(int index);

    int getUnsignedByte(int index);

    short getShort(int index, ByteOrder order);

    default int getUnsignedShort(int index, ByteOrder order) {
        return getShort(index, order) & 0xFFFF;
    }

    int getInt(int index, ByteOrder order);

    default long getUnsignedInt(int index, ByteOrder order) {
        return getInt(index, order) & 0xFFFFFFFFL;
    }

    long getLong(int index, ByteOrder order);

    /**
     * Copies the given length of data from this buffer into the given destination array.
     *
     * @param srcPos The byte offset into this buffer wherefrom the copying should start.
     * @param dest The destination byte array.
     * @param destPos The index into the {@code dest} array wherefrom the copying should start.
     * @param length The number of bytes to copy.
     * @throws IndexOutOfBoundsException if the ranges reach beyond the size of this buffer or the destination array.
     */
    void copyInto(int srcPos, byte[] dest, int destPos, int length);

    /**
     * @return A copy of the {@link #size()} bytes of this buffer.
     */
    byte[] toByteArray();

    /**
     * Get a read-only {@link ByteBuffer} view of the contents of this buffer, positioned at zero and limited to the
     * size. The view is only valid for as long as this buffer is not modified or dropped.
     *
     * @return A read-only view of the buffer contents.
     */
    ByteBuffer readableByteBuffer();

    /**
     * Create a zero-copy view of the given region of this buffer.
     * <p>
     * The slice retains the root buffer; releasing the slice releases that reference again.
     *
     * @param offset The offset of the first byte in the slice.
     * @param length The number of bytes in the slice.
     * @return The new slice, or {@code null} if the region is not within the size of this buffer.
     */
    Buffer slice(int offset, int length);

    /**
     * Create a slice from the given offset to the end of this buffer.
     *
     * @param offset The offset of the first byte in the slice.
     * @return The new slice, or {@code null} if the offset is beyond the size of this buffer.
     */
    default Buffer sliceFrom(int offset) {
        if (offset < 0 || offset > size()) {
            return null;
        }
        return slice(offset, size() - offset);
    }

    /**
     * Create a slice of the first {@code length} bytes of this buffer.
     *
     * @param length The number of bytes in the slice.
     * @return The new slice, or {@code null} if the length is greater than the size of this buffer.
     */
    default Buffer sliceTo(int length) {
        return slice(0, length);
    }

    /**
     * Change the size of this buffer, growing its memory if necessary.
     * Bytes added by growing the size have unspecified contents.
     *
     * @param newSize The new size.
     * @return {@code true} on success, or {@code false} if this buffer is not {@linkplain #isWritable() writable}
     * or cannot grow that large.
     * @throws IllegalArgumentException if the new size is negative.
     */
    boolean resize(int newSize);

    /**
     * Make sure this buffer has at least the given capacity. The size is not changed, and the capacity never shrinks.
     *
     * @param minCapacity The capacity wanted.
     * @return {@code true} if the buffer has the requested capacity, or {@code false} if it would need to grow and is
     * not {@linkplain #isWritable() writable}, or cannot grow that large.
     * @throws IllegalArgumentException if the capacity is negative.
     */
    boolean reserve(int minCapacity);

    /**
     * Append the given bytes to the end of this buffer.
     *
     * @return {@code true} on success, or {@code false} if this buffer is not {@linkplain #isWritable() writable}
     * or cannot grow that large. Appending zero bytes always succeeds.
     */
    boolean append(byte[] src, int srcPos, int length);

    default boolean append(byte[] src) {
        return append(src, 0, src.length);
    }

    /**
     * Append the contents of the given buffer to the end of this buffer.
     *
     * @return {@code true} on success, or {@code false} if this buffer is not {@linkplain #isWritable() writable}
     * or cannot grow that large.
     */
    boolean append(Buffer src);

    /**
     * Set the size of this buffer to zero. The capacity is unchanged.
     *
     * @return {@code true} on success, or {@code false} if this buffer is not {@linkplain #isWritable() writable}.
     */
    boolean clear();

    /**
     * Overwrite the byte at the given index, which must be within the {@linkplain #size() size}.
     *
     * @return {@code true} on success, or {@code false} if this buffer is not {@linkplain #isWritable() writable}.
     * @throws IndexOutOfBoundsException if the index is not within the size of this buffer.
     */
    boolean setByte(int index, byte value);

    /**
     * Overwrite a range of bytes, which must be within the {@linkplain #size() size}, with bytes from the given array.
     *
     * @return {@code true} on success, or {@code false} if this buffer is not {@linkplain #isWritable() writable}.
     * @throws IndexOutOfBoundsException if the range is not within the size of this buffer, or the source array.
     */
    boolean setBytes(int index, byte[] src, int srcPos, int length);

    /**
     * Read bytes from the given channel directly into the memory after the end of this buffer, growing it first.
     * Only the bytes actually read are added to the size.
     *
     * @param channel The channel to read from.
     * @param maxBytes The most bytes to read, or {@code 0} for a default chunk of 4096 bytes.
     * @return The number of bytes read, {@code 0} if the channel had nothing to give or reached end of stream,
     * or {@code -1} if this buffer is not {@linkplain #isWritable() writable} or cannot grow that large.
     * @throws IOException if the channel throws.
     */
    int transferFrom(ReadableByteChannel channel, int maxBytes) throws IOException;

    /**
     * Write all {@linkplain #size() size} bytes of this buffer to the given channel.
     * Writing stops early if the channel stops accepting bytes.
     *
     * @param channel The channel to write to.
     * @return The number of bytes written.
     * @throws IOException if the channel throws.
     */
    int transferTo(WritableByteChannel channel) throws IOException;
}
