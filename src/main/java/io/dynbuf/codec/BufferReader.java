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
package io.dynbuf.codec;

import io.dynbuf.Buffer;
import io.dynbuf.BufferAllocator;

import java.nio.ByteOrder;
import java.nio.charset.Charset;

import static io.dynbuf.internal.Statics.outOfBounds;
import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;
import static java.nio.ByteOrder.BIG_ENDIAN;
import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * A cursor that reads fixed-width binary values from a {@link Buffer}.
 * <p>
 * The reader holds its own reference to the buffer, taken when it is created and released when it is closed.
 * A read that would go past the end of the buffer throws an {@link IndexOutOfBoundsException}
 * and leaves the {@linkplain #position() position} where it was.
 */
public final class BufferReader implements AutoCloseable {
    private Buffer buffer;
    private int position;

    /**
     * Create a reader positioned at the start of the given buffer. The buffer is retained.
     */
    public BufferReader(Buffer buffer) {
        this.buffer = checkNotNull(buffer, "buffer").retain();
    }

    public int position() {
        checkOpen();
        return position;
    }

    /**
     * @return The number of bytes between the position and the end of the buffer.
     */
    public int remaining() {
        return buffer().size() - position;
    }

    /**
     * @return {@code true} if at least {@code length} more bytes can be read.
     */
    public boolean canRead(int length) {
        return length >= 0 && length <= remaining();
    }

    /**
     * Move the read position.
     *
     * @throws IndexOutOfBoundsException if the position is negative or beyond the size of the buffer.
     */
    public BufferReader seek(int position) {
        int size = buffer().size();
        if (position < 0 || position > size) {
            throw outOfBounds(position, 0, size);
        }
        this.position = position;
        return this;
    }

    /**
     * Move the read position forward without reading.
     */
    public BufferReader skip(int length) {
        checkPositiveOrZero(length, "length");
        checkReadable(length);
        position += length;
        return this;
    }

    public byte readByte() {
        byte value = buffer().getByte(position);
        position += Byte.BYTES;
        return value;
    }

    public int readUnsignedByte() {
        return readByte() & 0xFF;
    }

    public short readShortLE() {
        return readShort(LITTLE_ENDIAN);
    }

    public short readShortBE() {
        return readShort(BIG_ENDIAN);
    }

    public int readUnsignedShortLE() {
        return readShortLE() & 0xFFFF;
    }

    public int readUnsignedShortBE() {
        return readShortBE() & 0xFFFF;
    }

    public int readIntLE() {
        return readInt(LITTLE_ENDIAN);
    }

    public int readIntBE() {
        return readInt(BIG_ENDIAN);
    }

    public long readUnsignedIntLE() {
        return readIntLE() & 0xFFFFFFFFL;
    }

    public long readUnsignedIntBE() {
        return readIntBE() & 0xFFFFFFFFL;
    }

    public long readLongLE() {
        return readLong(LITTLE_ENDIAN);
    }

    public long readLongBE() {
        return readLong(BIG_ENDIAN);
    }

    public short readShort(ByteOrder order) {
        short value = buffer().getShort(position, order);
        position += Short.BYTES;
        return value;
    }

    public int readInt(ByteOrder order) {
        int value = buffer().getInt(position, order);
        position += Integer.BYTES;
        return value;
    }

    public long readLong(ByteOrder order) {
        long value = buffer().getLong(position, order);
        position += Long.BYTES;
        return value;
    }

    /**
     * Read exactly {@code length} bytes into the given array.
     */
    public BufferReader readBytes(byte[] dest, int destPos, int length) {
        buffer().copyInto(position, dest, destPos, length);
        position += length;
        return this;
    }

    public BufferReader readBytes(byte[] dest) {
        return readBytes(checkNotNull(dest, "dest"), 0, dest.length);
    }

    /**
     * Read the given number of bytes into a new array.
     */
    public byte[] readBytes(int length) {
        checkPositiveOrZero(length, "length");
        checkReadable(length);
        byte[] bytes = new byte[length];
        readBytes(bytes, 0, length);
        return bytes;
    }

    /**
     * Read the given number of bytes as a zero-copy {@linkplain Buffer#slice(int, int) slice} of the buffer.
     * The caller owns the slice and must release it.
     */
    public Buffer readSlice(int length) {
        checkPositiveOrZero(length, "length");
        checkReadable(length);
        Buffer slice = buffer.slice(position, length);
        position += length;
        return slice;
    }

    /**
     * Read the given number of bytes into a new buffer from the given allocator.
     */
    public Buffer readCopy(BufferAllocator allocator, int length) {
        checkNotNull(allocator, "allocator");
        byte[] bytes = readBytes(length);
        return allocator.adopt(bytes, length);
    }

    /**
     * Read the given number of bytes and decode them as characters with the given charset.
     */
    public String readCharSequence(int length, Charset charset) {
        checkNotNull(charset, "charset");
        return new String(readBytes(length), charset);
    }

    /**
     * Release the reference to the buffer. Closing a reader more than once has no effect.
     */
    @Override
    public void close() {
        Buffer buf = buffer;
        if (buf != null) {
            buffer = null;
            buf.release();
        }
    }

    private void checkReadable(int length) {
        int size = buffer().size();
        if ((long) position + length > size) {
            throw outOfBounds(position, length, size);
        }
    }

    private Buffer buffer() {
        checkOpen();
        return buffer;
    }

    private void checkOpen() {
        if (buffer == null) {
            throw new IllegalStateException("This reader is closed.");
        }
    }

    @Override
    public String toString() {
        return buffer == null? "BufferReader[closed]" :
                "BufferReader[position=" + position + ", buffer=" + buffer + ']';
    }
}
