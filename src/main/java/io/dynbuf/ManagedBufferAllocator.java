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

import java.util.Arrays;
import java.util.Objects;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

class ManagedBufferAllocator implements BufferAllocator {
    private final boolean leakDetection;

    ManagedBufferAllocator(boolean leakDetection) {
        this.leakDetection = leakDetection;
    }

    @Override
    public Buffer allocate(int capacity) {
        BufferAllocator.checkSize(capacity);
        return create(new byte[capacity], 0);
    }

    @Override
    public Buffer copyOf(byte[] data, int offset, int length) {
        if (data == null && length == 0) {
            return allocate(0);
        }
        checkNotNull(data, "data");
        Objects.checkFromIndexSize(offset, length, data.length);
        return create(Arrays.copyOfRange(data, offset, offset + length), length);
    }

    @Override
    public Buffer adopt(byte[] memory, int size) {
        checkNotNull(memory, "memory");
        if (size < 0 || size > memory.length) {
            return null;
        }
        return create(memory, size);
    }

    /**
     * Wrap the given disposal action in the per-buffer machinery this allocator is configured with.
     * Every buffer, including slices, needs its own drop instance.
     */
    Drop<ArrayBuffer> decorate(Drop<ArrayBuffer> drop) {
        return leakDetection? new LeakDetectingDrop(drop) : drop;
    }

    private Buffer create(byte[] memory, int size) {
        Drop<ArrayBuffer> drop = decorate(ArrayBuffer.DETACH_MEMORY);
        ArrayBuffer buf = new ArrayBuffer(memory, size, drop, this);
        drop.attach(buf);
        return buf;
    }

    @Override
    public String toString() {
        return leakDetection? "heap(leakDetection)" : "heap";
    }
}
