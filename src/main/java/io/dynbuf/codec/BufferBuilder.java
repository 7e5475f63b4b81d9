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
import io.dynbuf.internal.ByteArrayAccess;

import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.dynbuf.internal.Statics.bufferIsNotWritable;
import static io.dynbuf.internal.Statics.outOfBounds;
import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static java.nio.ByteOrder.BIG_ENDIAN;
import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * A cursor that writes fixed-width binary values into a {@link Buffer}, growing it as needed.
 * <p>
 * The builder writes at its {@linkplain #position() position}, which starts at the end of the buffer.
 * Writing past the end of the buffer extends its size.
 * After {@linkplain #seek(int) seeking} back, writes overwrite existing bytes, and the size is left alone.
 * <p>
 * The builder owns its buffer until {@link #finish()} hands it back.
 * A builder that is closed without being finished releases its buffer.
 * <pre>{@code
 *     try (BufferBuilder builder = new BufferBuilder(allocator, 64)) {
 *         builder.writeByte(0x42).writeShortLE(0x1234).writeCString("Test");
 *         return builder.finish();
 *     }
 * }</pre>
 */
public final class BufferBuilder implements AutoCloseable {
    private final byte[] scratch = new byte[Long.BYTES];
    private Buffer buffer;
    private int position;

    /**
     * Create a builder writing into a new, empty buffer.
     *
     * @param allocator The allocator of the buffer.
     * @param initialCapacity The capacity of the buffer, before it needs to grow.
     */
    public BufferBuilder(BufferAllocator allocator, int initialCapacity) {
        this(checkNotNull(allocator, "allocator").allocate(initialCapacity));
    }

    private BufferBuilder(Buffer buffer) {
        this.buffer = buffer;
        position = buffer.size();
    }

    /**
     * Create a builder that continues writing at the end of the given buffer.
     * The reference to the buffer is transferred to the builder, and comes back from {@link #finish()}.
     *
     * @param buffer The buffer to append to.
     * @return A builder positioned at the end of the buffer.
     * @throws IllegalArgumentException if the buffer is not {@linkplain Buffer#isWritable() writable}.
     */
    public static BufferBuilder from(Buffer buffer) {
        checkNotNull(buffer, "buffer");
        if (!buffer.isWritable()) {
            throw new IllegalArgumentException(bufferIsNotWritable(buffer).getMessage());
        }
        return new BufferBuilder(buffer);
    }

    /**
     * @return The offset into the buffer where the next write will take place.
     */
    public int position() {
        checkActive();
        return position;
    }

    /**
     * @return The size of the buffer being built.
     */
    public int size() {
        return buffer().size();
    }

    /**
     * Move the write position. Only positions within the bytes already written can be sought to.
     *
     * @param position The new write position.
     * @return This builder.
     * @throws IndexOutOfBoundsException if the position is negative or beyond the size of the buffer.
     */
    public BufferBuilder seek(int position) {
        int size = buffer().size();
        if (position < 0 || position > size) {
            throw outOfBounds(position, 0, size);
        }
        this.position = position;
        return this;
    }

    public BufferBuilder writeByte(int value) {
        scratch[0] = (byte) value;
        return write(scratch, 0, Byte.BYTES);
    }

    public BufferBuilder writeShortLE(int value) {
        return writeShort(value, LITTLE_ENDIAN);
    }

    public BufferBuilder writeShortBE(int value) {
        return writeShort(value, BIG_ENDIAN);
    }

    public BufferBuilder writeIntLE(long value) {
        return writeInt(value, LITTLE_ENDIAN);
    }

    public BufferBuilder writeIntBE(long value) {
        return writeInt(value, BIG_ENDIAN);
    }

    public BufferBuilder writeLongLE(long value) {
        return writeLong(value, LITTLE_ENDIAN);
    }

    public BufferBuilder writeLongBE(long value) {
        return writeLong(value, BIG_ENDIAN);
    }

    /**
     * Write the low 16 bits of the given value.
     */
    public BufferBuilder writeShort(int value, ByteOrder order) {
        ByteArrayAccess.setShort(scratch, 0, (short) value, order);
        return write(scratch, 0, Short.BYTES);
    }

    /**
     * Write the low 32 bits of the given value, so unsigned 32-bit values can be passed as {@code long}.
     */
    public BufferBuilder writeInt(long value, ByteOrder order) {
        ByteArrayAccess.setInt(scratch, 0, (int) value, order);
        return write(scratch, 0, Integer.BYTES);
    }

    public BufferBuilder writeLong(long value, ByteOrder order) {
        ByteArrayAccess.setLong(scratch, 0, value, order);
        return write(scratch, 0, Long.BYTES);
    }

    public BufferBuilder writeBytes(byte[] src) {
        return writeBytes(src, 0, checkNotNull(src, "src").length);
    }

    public BufferBuilder writeBytes(byte[] src, int srcPos, int length) {
        checkNotNull(src, "src");
        Objects.checkFromIndexSize(srcPos, length, src.length);
        return write(src, srcPos, length);
    }

    /**
     * Write all the bytes of the given buffer. The source buffer is not modified.
     */
    public BufferBuilder writeBytes(Buffer src) {
        return write(checkNotNull(src, "src").toByteArray(), 0, src.size());
    }

    /**
     * Write the characters encoded with the given charset. No length prefix or terminator is written.
     */
    public BufferBuilder writeCharSequence(CharSequence text, Charset charset) {
        checkNotNull(text, "text");
        checkNotNull(charset, "charset");
        byte[] bytes = text.toString().getBytes(charset);
        return write(bytes, 0, bytes.length);
    }

    /**
     * Write the UTF-8 bytes of the given string, without a terminating zero byte.
     */
    public BufferBuilder writeCString(String text) {
        return writeCharSequence(text, StandardCharsets.UTF_8);
    }

    /**
     * Hand the buffer back to the caller. The builder cannot be used afterwards.
     *
     * @return The built buffer, with the reference the builder held.
     */
    public Buffer finish() {
        Buffer result = buffer();
        buffer = null;
        return result;
    }

    /**
     * Release the buffer, unless the builder has already been {@linkplain #finish() finished}.
     */
    @Override
    public void close() {
        Buffer buf = buffer;
        if (buf != null) {
            buffer = null;
            buf.release();
        }
    }

    private BufferBuilder write(byte[] src, int srcPos, int length) {
        Buffer buf = buffer();
        long end = (long) position + length;
        if (end > buf.size() && !buf.resize(checkEnd(end))) {
            throw bufferIsNotWritable(buf);
        }
        if (!buf.setBytes(position, src, srcPos, length)) {
            throw bufferIsNotWritable(buf);
        }
        position += length;
        return this;
    }

    private static int checkEnd(long end) {
        BufferAllocator.checkSize(end);
        return (int) end;
    }

    private Buffer buffer() {
        checkActive();
        return buffer;
    }

    private void checkActive() {
        if (buffer == null) {
            throw new IllegalStateException("This builder has been finished or closed.");
        }
    }
}
