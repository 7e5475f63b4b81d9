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
package io.dynbuf.adaptor;

import io.dynbuf.Buffer;
import io.dynbuf.BufferAllocator;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Copies bytes between {@link Buffer}s and Netty {@link ByteBuf}s.
 * <p>
 * None of these methods share memory between the two kinds of buffer, and none of them change reference counts.
 */
public final class ByteBufAdaptor {
    private ByteBufAdaptor() {
    }

    /**
     * Copy the readable bytes of the given {@link ByteBuf} into a new buffer. The reader index is not moved.
     */
    public static Buffer copyOf(BufferAllocator allocator, ByteBuf byteBuf) {
        checkNotNull(allocator, "allocator");
        checkNotNull(byteBuf, "byteBuf");
        int length = byteBuf.readableBytes();
        byte[] bytes = new byte[length];
        byteBuf.getBytes(byteBuf.readerIndex(), bytes);
        return allocator.adopt(bytes, length);
    }

    /**
     * Copy the contents of the given buffer into a new unpooled heap {@link ByteBuf}.
     */
    public static ByteBuf toByteBuf(Buffer buffer) {
        checkNotNull(buffer, "buffer");
        return Unpooled.wrappedBuffer(buffer.toByteArray());
    }

    /**
     * Append the contents of the given buffer to the {@link ByteBuf}, growing it if needed.
     */
    public static void writeTo(Buffer buffer, ByteBuf byteBuf) {
        checkNotNull(buffer, "buffer");
        checkNotNull(byteBuf, "byteBuf");
        byteBuf.writeBytes(buffer.readableByteBuffer());
    }

    /**
     * Append all the readable bytes of the {@link ByteBuf} to the given buffer, and consume them.
     *
     * @return {@code true} on success, or {@code false} if the buffer is not {@linkplain Buffer#isWritable() writable},
     * in which case the {@link ByteBuf} is left as it was.
     */
    public static boolean readFrom(Buffer buffer, ByteBuf byteBuf) {
        checkNotNull(buffer, "buffer");
        checkNotNull(byteBuf, "byteBuf");
        int length = byteBuf.readableBytes();
        if (length == 0) {
            return true;
        }
        if (!buffer.isWritable()) {
            return false;
        }
        byte[] bytes = new byte[length];
        byteBuf.getBytes(byteBuf.readerIndex(), bytes);
        if (!buffer.append(bytes, 0, length)) {
            return false;
        }
        byteBuf.skipBytes(length);
        return true;
    }
}
