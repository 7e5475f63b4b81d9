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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BufferTest extends BufferTestSupport {
    @ParameterizedTest
    @MethodSource("allocators")
    void allocateMustReturnEmptyBufferWithRequestedCapacity(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = allocator.allocate(16)) {
            assertEquals(0, buf.size());
            assertEquals(16, buf.capacity());
            assertThat(buf.isEmpty()).isTrue();
            assertThat(buf.isSlice()).isFalse();
            assertThat(buf.isOwned()).isTrue();
            assertThat(buf.isWritable()).isTrue();
            assertEquals(1, buf.refCount());
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void allocateOfZeroCapacityMustBeAllowed(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = allocator.allocate(0)) {
            assertEquals(0, buf.capacity());
            assertThat(buf.append(new byte[] { 1 })).isTrue();
            assertThat(buf.capacity()).isGreaterThanOrEqualTo(1);
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void allocateOfNegativeOrHugeCapacityMustThrow(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator()) {
            assertThrows(IllegalArgumentException.class, () -> allocator.allocate(-1));
            assertThrows(IllegalArgumentException.class, () -> allocator.allocate(Integer.MAX_VALUE));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void copyOfMustCopyTheGivenRange(Fixture fixture) {
        byte[] data = { 1, 2, 3, 4, 5 };
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = allocator.copyOf(data, 1, 3)) {
            data[2] = 42;
            assertEquals(3, buf.size());
            assertEquals(3, buf.capacity());
            assertThat(buf.toByteArray()).containsExactly(2, 3, 4);
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void copyOfNullOrEmptyMustGiveEmptyBuffer(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer fromNull = allocator.copyOf(null);
             Buffer fromNullRange = allocator.copyOf(null, 0, 0);
             Buffer fromEmpty = allocator.copyOf(new byte[0])) {
            assertEquals(0, fromNull.size());
            assertEquals(0, fromNullRange.size());
            assertEquals(0, fromEmpty.size());
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void adoptMustUseTheGivenArrayWithoutCopying(Fixture fixture) {
        byte[] memory = { 1, 2, 3, 0, 0, 0, 0, 0 };
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = allocator.adopt(memory, 3)) {
            assertEquals(3, buf.size());
            assertEquals(8, buf.capacity());
            memory[0] = 9;
            assertEquals(9, buf.getByte(0));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void adoptWithInvalidSizeMustReturnNull(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator()) {
            assertThat(allocator.adopt(new byte[4], 5)).isNull();
            assertThat(allocator.adopt(new byte[4], -1)).isNull();
            assertThrows(NullPointerException.class, () -> allocator.adopt(null, 0));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void appendMustGrowByDoubling(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = allocator.allocate(4)) {
            assertThat(buf.append(new byte[] { 1, 2, 3, 4, 5 })).isTrue();
            assertEquals(5, buf.size());
            assertEquals(8, buf.capacity());
            assertThat(buf.append(new byte[20])).isTrue();
            assertEquals(25, buf.size());
            assertEquals(25, buf.capacity());
            assertThat(buf.toByteArray()).startsWith(1, 2, 3, 4, 5);
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void appendOfEmptyArrayMustSucceedWithoutChanges(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferOf(allocator, 1, 2)) {
            assertThat(buf.append(new byte[0])).isTrue();
            assertThat(buf.append(null, 0, 0)).isTrue();
            assertThat(buf.toByteArray()).containsExactly(1, 2);
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void appendOfRangeOutsideSourceMustThrow(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = allocator.allocate(8)) {
            assertThrows(IndexOutOfBoundsException.class, () -> buf.append(new byte[4], 2, 3));
            assertEquals(0, buf.size());
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void appendOfBufferToItselfMustDoubleContents(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferOf(allocator, 1, 2, 3)) {
            assertThat(buf.append(buf)).isTrue();
            assertThat(buf.toByteArray()).containsExactly(1, 2, 3, 1, 2, 3);
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void appendOfOtherBufferMustCopyItsBytes(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferOf(allocator, 1);
             Buffer other = bufferOf(allocator, 2, 3)) {
            assertThat(buf.append(other)).isTrue();
            assertThat(buf.toByteArray()).containsExactly(1, 2, 3);
            assertThat(other.toByteArray()).containsExactly(2, 3);
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void resizeMustChangeSizeAndKeepContents(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferOf(allocator, 1, 2, 3, 4)) {
            assertThat(buf.resize(2)).isTrue();
            assertThat(buf.toByteArray()).containsExactly(1, 2);
            assertEquals(4, buf.capacity());
            assertThat(buf.resize(10)).isTrue();
            assertEquals(10, buf.size());
            assertThat(buf.capacity()).isGreaterThanOrEqualTo(10);
            assertEquals(1, buf.getByte(0));
            assertEquals(2, buf.getByte(1));
            assertThrows(IllegalArgumentException.class, () -> buf.resize(-1));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void reserveMustGrowCapacityOnly(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferOf(allocator, 7)) {
            assertThat(buf.reserve(1)).isTrue();
            assertEquals(1, buf.capacity());
            assertThat(buf.reserve(100)).isTrue();
            assertEquals(100, buf.capacity());
            assertEquals(1, buf.size());
            assertEquals(7, buf.getByte(0));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void clearMustKeepCapacity(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferWithRoom(allocator, 4, 1, 2, 3)) {
            assertThat(buf.clear()).isTrue();
            assertEquals(0, buf.size());
            assertEquals(7, buf.capacity());
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void setByteMustWriteInPlace(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferOf(allocator, 1, 2, 3)) {
            assertThat(buf.setByte(1, (byte) 0x7F)).isTrue();
            assertThat(buf.setBytes(2, new byte[] { 9, 8 }, 1, 1)).isTrue();
            assertThat(buf.toByteArray()).containsExactly(1, 0x7F, 8);
            assertThrows(IndexOutOfBoundsException.class, () -> buf.setByte(3, (byte) 0));
            assertThrows(IndexOutOfBoundsException.class, () -> buf.setBytes(2, new byte[2], 0, 2));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void getByteOutsideSizeMustThrowEvenWithinCapacity(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferWithRoom(allocator, 8, 1, 2)) {
            assertThrows(IndexOutOfBoundsException.class, () -> buf.getByte(2));
            assertThrows(IndexOutOfBoundsException.class, () -> buf.getByte(-1));
            var e = assertThrows(IndexOutOfBoundsException.class, () -> buf.copyInto(1, new byte[2], 0, 2));
            assertThat(e).hasMessageContaining("bounds");
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void readableByteBufferMustBeReadOnlyViewOfContents(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer buf = bufferWithRoom(allocator, 4, 1, 2, 3)) {
            ByteBuffer view = buf.readableByteBuffer();
            assertEquals(3, view.remaining());
            assertEquals(1, view.get(0));
            assertThrows(ReadOnlyBufferException.class, () -> view.put(0, (byte) 9));
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void buffersWithEqualContentsMustBeEqual(Fixture fixture) {
        try (BufferAllocator allocator = fixture.createAllocator();
             Buffer a = bufferWithRoom(allocator, 8, 1, 2, 3);
             Buffer b = bufferOf(allocator, 1, 2, 3);
             Buffer c = bufferOf(allocator, 1, 2, 4)) {
            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
            assertThat(a).isNotEqualTo(c);
            assertThat(a.compareTo(c)).isEqualTo(-1);
            assertThat(c.compareTo(a)).isEqualTo(1);
            assertThat(a.compareTo(b)).isZero();
        }
    }

    @Test
    void toStringMustDescribeBuffer() {
        try (BufferAllocator allocator = BufferAllocator.heap()) {
            Buffer buf = bufferWithRoom(allocator, 4, 1, 2);
            assertThat(buf.toString()).isEqualTo("Buffer[size=2, capacity=6, refCount=1]");
            Buffer slice = buf.slice(0, 1);
            assertThat(slice.toString()).isEqualTo("Buffer[size=1, capacity=1, refCount=1, slice]");
            slice.close();
            buf.close();
            assertThat(buf.toString()).isEqualTo("Buffer[closed]");
        }
    }
}
