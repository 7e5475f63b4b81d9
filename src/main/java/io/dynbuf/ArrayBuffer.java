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

import io.dynbuf.internal.ByteArrayAccess;
import io.netty.util.internal.MathUtil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.Arrays;
import java.util.Objects;

import static io.dynbuf.internal.Statics.MAX_CAPACITY;
import static io.dynbuf.internal.Statics.bufferIsClosed;
import static io.dynbuf.internal.Statics.outOfBounds;
import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * A {@link Buffer} backed by a byte array.
 * <p>
 * A root buffer owns its array, and replaces it with a bigger copy when it needs to grow.
 * A slice has no array of its own; it reads through the array of the root it retains, at a fixed offset.
 * The root cannot grow, and thereby swap its array, while slices are alive, because the slices keep it shared.
 */
final class ArrayBuffer extends RcSupport<Buffer, ArrayBuffer> implements Buffer {
    static final int DEFAULT_READ_CHUNK = 4096;
    private static final byte[] CLOSED_MEMORY = new byte[0];

    static final Drop<ArrayBuffer> DETACH_MEMORY = new Drop<ArrayBuffer>() {
        @Override
        public void drop(ArrayBuffer buf) {
            buf.makeInaccessible();
        }

        @Override
        public String toString() {
            return "DETACH_MEMORY";
        }
    };

    static final Drop<ArrayBuffer> RELEASE_ROOT = new Drop<ArrayBuffer>() {
        @Override
        public void drop(ArrayBuffer slice) {
            ArrayBuffer root = slice.root;
            slice.makeInaccessible();
            root.release();
        }

        @Override
        public String toString() {
            return "RELEASE_ROOT";
        }
    };

    private final ManagedBufferAllocator control;
    private final ArrayBuffer root;
    private final int offset;
    private byte[] memory;
    private int size;

    ArrayBuffer(byte[] memory, int size, Drop<ArrayBuffer> drop, ManagedBufferAllocator control) {
        super(drop);
        this.control = control;
        this.memory = memory;
        this.size = size;
        root = null;
        offset = 0;
    }

    private ArrayBuffer(ArrayBuffer root, int offset, int length, Drop<ArrayBuffer> drop,
                        ManagedBufferAllocator control) {
        super(drop);
        this.control = control;
        this.root = root;
        this.offset = offset;
        size = length;
    }

    @Override
    public int size() {
        checkAccessible();
        return size;
    }

    @Override
    public int capacity() {
        checkAccessible();
        return root == null? memory.length : size;
    }

    @Override
    public boolean isSlice() {
        return root != null;
    }

    @Override
    public boolean isWritable() {
        return root == null && refCount() == 1;
    }

    // <editor-fold defaultstate="collapsed" desc="Read access">
    @Override
    public byte getByte(int index) {
        checkRead(index, Byte.BYTES);
        return array()[offset + index];
    }

    @Override
    public int getUnsignedByte(int index) {
        return getByte(index) & 0xFF;
    }

    @Override
    public short getShort(int index, ByteOrder order) {
        checkRead(index, Short.BYTES);
        return ByteArrayAccess.getShort(array(), offset + index, order);
    }

    @Override
    public int getInt(int index, ByteOrder order) {
        checkRead(index, Integer.BYTES);
        return ByteArrayAccess.getInt(array(), offset + index, order);
    }

    @Override
    public long getLong(int index, ByteOrder order) {
        checkRead(index, Long.BYTES);
        return ByteArrayAccess.getLong(array(), offset + index, order);
    }

    @Override
    public void copyInto(int srcPos, byte[] dest, int destPos, int length) {
        checkNotNull(dest, "dest");
        checkRead(srcPos, length);
        Objects.checkFromIndexSize(destPos, length, dest.length);
        System.arraycopy(array(), offset + srcPos, dest, destPos, length);
    }

    @Override
    public byte[] toByteArray() {
        checkAccessible();
        return Arrays.copyOfRange(array(), offset, offset + size);
    }

    @Override
    public ByteBuffer readableByteBuffer() {
        checkAccessible();
        return ByteBuffer.wrap(array(), offset, size).slice().asReadOnlyBuffer();
    }
    // </editor-fold>

    @Override
    public Buffer slice(int offset, int length) {
        checkAccessible();
        if (offset < 0 || length < 0 || offset > size || (long) offset + length > size) {
            return null;
        }
        ArrayBuffer owner = root == null? this : root;
        owner.retain();
        owner.trace("slice");
        Drop<ArrayBuffer> drop = control.decorate(RELEASE_ROOT);
        ArrayBuffer slice = new ArrayBuffer(owner, this.offset + offset, length, drop, control);
        drop.attach(slice);
        return slice;
    }

    // <editor-fold defaultstate="collapsed" desc="Guarded mutation">
    @Override
    public boolean resize(int newSize) {
        checkPositiveOrZero(newSize, "newSize");
        checkAccessible();
        if (!isWritable() || !ensureCapacity(newSize)) {
            return false;
        }
        size = newSize;
        return true;
    }

    @Override
    public boolean reserve(int minCapacity) {
        checkPositiveOrZero(minCapacity, "minCapacity");
        if (minCapacity <= capacity()) {
            return true;
        }
        return isWritable() && ensureCapacity(minCapacity);
    }

    @Override
    public boolean append(byte[] src, int srcPos, int length) {
        checkAccessible();
        if (length == 0) {
            return true;
        }
        checkNotNull(src, "src");
        Objects.checkFromIndexSize(srcPos, length, src.length);
        if (!isWritable() || !ensureCapacity((long) size + length)) {
            return false;
        }
        System.arraycopy(src, srcPos, memory, size, length);
        size += length;
        return true;
    }

    @Override
    public boolean append(Buffer src) {
        checkNotNull(src, "src");
        checkAccessible();
        int length = src.size();
        if (length == 0) {
            return true;
        }
        if (!isWritable() || !ensureCapacity((long) size + length)) {
            return false;
        }
        // Reading happens after growing, so appending a buffer to itself copies from the new memory.
        src.copyInto(0, memory, size, length);
        size += length;
        return true;
    }

    @Override
    public boolean clear() {
        checkAccessible();
        if (!isWritable()) {
            return false;
        }
        size = 0;
        return true;
    }

    @Override
    public boolean setByte(int index, byte value) {
        checkRead(index, Byte.BYTES);
        if (!isWritable()) {
            return false;
        }
        memory[index] = value;
        return true;
    }

    @Override
    public boolean setBytes(int index, byte[] src, int srcPos, int length) {
        checkNotNull(src, "src");
        checkRead(index, length);
        Objects.checkFromIndexSize(srcPos, length, src.length);
        if (!isWritable()) {
            return false;
        }
        System.arraycopy(src, srcPos, memory, index, length);
        return true;
    }

    @Override
    public int transferFrom(ReadableByteChannel channel, int maxBytes) throws IOException {
        checkNotNull(channel, "channel");
        checkPositiveOrZero(maxBytes, "maxBytes");
        checkAccessible();
        int length = Math.min(maxBytes == 0? DEFAULT_READ_CHUNK : maxBytes, MAX_CAPACITY - size);
        if (length == 0 || !isWritable() || !ensureCapacity((long) size + length)) {
            return -1;
        }
        int bytesRead = channel.read(ByteBuffer.wrap(memory, size, length));
        if (bytesRead <= 0) {
            return 0;
        }
        size += bytesRead;
        return bytesRead;
    }

    @Override
    public int transferTo(WritableByteChannel channel) throws IOException {
        checkNotNull(channel, "channel");
        ByteBuffer src = readableByteBuffer();
        int written = 0;
        while (src.hasRemaining()) {
            int n = channel.write(src);
            if (n <= 0) {
                break;
            }
            written += n;
        }
        return written;
    }

    /**
     * Grow the memory of this root buffer to at least the given capacity, doubling the current capacity if that is
     * bigger. The caller must have checked that this buffer is writable.
     */
    private boolean ensureCapacity(long minCapacity) {
        if (minCapacity <= memory.length) {
            return true;
        }
        if (minCapacity > MAX_CAPACITY) {
            return false;
        }
        int newCapacity = (int) Math.min(Math.max(minCapacity, 2L * memory.length), MAX_CAPACITY);
        memory = Arrays.copyOf(memory, newCapacity);
        return true;
    }
    // </editor-fold>

    /**
     * The array holding the bytes of this buffer. Only valid while this buffer is accessible.
     */
    byte[] array() {
        return root == null? memory : root.memory;
    }

    /**
     * The offset into {@link #array()} where the bytes of this buffer start.
     */
    int arrayOffset() {
        return offset;
    }

    private void makeInaccessible() {
        memory = CLOSED_MEMORY;
        size = 0;
    }

    private void checkAccessible() {
        if (!isAccessible()) {
            throw attachTrace(bufferIsClosed());
        }
    }

    private void checkRead(int index, int length) {
        checkAccessible();
        if (MathUtil.isOutOfBounds(index, length, size)) {
            throw outOfBounds(index, length, size);
        }
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Buffer && BufferUtil.equals(this, (Buffer) obj);
    }

    @Override
    public int hashCode() {
        return BufferUtil.hashCode(this);
    }

    @Override
    public int compareTo(Buffer other) {
        return BufferUtil.compare(this, other);
    }

    @Override
    public String toString() {
        if (!isAccessible()) {
            return "Buffer[closed]";
        }
        return "Buffer[size=" + size + ", capacity=" + (root == null? memory.length : size) +
               ", refCount=" + refCount() + (root == null? "]" : ", slice]");
    }
}
