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
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ByteBufAdaptorTest {
    private BufferAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = BufferAllocator.heap();
    }

    @AfterEach
    void tearDown() {
        allocator.close();
    }

    @Test
    void copyOfMustCopyReadableBytesWithoutConsumingThem() {
        ByteBuf byteBuf = Unpooled.buffer(16).writeBytes(new byte[] { 1, 2, 3, 4 });
        try {
            byteBuf.readByte();
            try (Buffer buf = ByteBufAdaptor.copyOf(allocator, byteBuf)) {
                assertThat(buf.toByteArray()).containsExactly(2, 3, 4);
                assertEquals(3, buf.capacity());
            }
            assertEquals(1, byteBuf.readerIndex());
            assertEquals(1, byteBuf.refCnt());
        } finally {
            byteBuf.release();
        }
    }

    @Test
    void toByteBufMustCopyContents() {
        try (Buffer buf = allocator.copyOf(new byte[] { 1, 2, 3, 4, 5 });
             Buffer slice = buf.slice(1, 3)) {
            ByteBuf byteBuf = ByteBufAdaptor.toByteBuf(slice);
            try {
                assertEquals("020304", ByteBufUtil.hexDump(byteBuf));
                byteBuf.setByte(0, 9);
                assertEquals(2, slice.getByte(0));
            } finally {
                byteBuf.release();
            }
        }
    }

    @Test
    void writeToMustAppendToByteBuf() {
        ByteBuf byteBuf = Unpooled.buffer(1).writeByte(7);
        try (Buffer buf = allocator.copyOf(new byte[] { 8, 9 })) {
            ByteBufAdaptor.writeTo(buf, byteBuf);
            assertEquals("070809", ByteBufUtil.hexDump(byteBuf));
            assertEquals(2, buf.size());
        } finally {
            byteBuf.release();
        }
    }

    @Test
    void readFromMustConsumeByteBuf() {
        ByteBuf byteBuf = Unpooled.wrappedBuffer(new byte[] { 3, 4, 5 });
        try (Buffer buf = allocator.copyOf(new byte[] { 1, 2 })) {
            assertThat(ByteBufAdaptor.readFrom(buf, byteBuf)).isTrue();
            assertThat(buf.toByteArray()).containsExactly(1, 2, 3, 4, 5);
            assertThat(byteBuf.isReadable()).isFalse();
        } finally {
            byteBuf.release();
        }
    }

    @Test
    void readFromIntoSharedBufferMustLeaveByteBufUntouched() {
        ByteBuf byteBuf = Unpooled.wrappedBuffer(new byte[] { 3, 4, 5 });
        try (Buffer buf = allocator.copyOf(new byte[] { 1, 2 });
             Buffer slice = buf.slice(0, 2)) {
            assertThat(ByteBufAdaptor.readFrom(buf, byteBuf)).isFalse();
            assertThat(ByteBufAdaptor.readFrom(slice, byteBuf)).isFalse();
            assertEquals(3, byteBuf.readableBytes());
            assertThat(buf.toByteArray()).containsExactly(1, 2);
        } finally {
            byteBuf.release();
        }
    }

    @Test
    void readFromEmptyByteBufMustSucceedEvenWhenShared() {
        try (Buffer buf = allocator.copyOf(new byte[] { 1 });
             Buffer slice = buf.slice(0, 1)) {
            assertThat(ByteBufAdaptor.readFrom(slice, Unpooled.EMPTY_BUFFER)).isTrue();
        }
    }
}
