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
package io.dynbuf.internal;

import io.dynbuf.Buffer;

import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.VarHandle;
import java.lang.ref.Cleaner;

public interface Statics {
    Cleaner CLEANER = Cleaner.create();

    /**
     * The largest capacity a buffer can have. Buffers are backed by byte arrays, so this is the max array size.
     */
    int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    static VarHandle findVarHandle(Lookup lookup, Class<?> recv, String name, Class<?> type) {
        try {
            return lookup.findVarHandle(recv, name, type);
        } catch (Exception e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    static IllegalStateException bufferIsClosed() {
        return new IllegalStateException("This buffer is closed.");
    }

    static IllegalStateException bufferIsNotWritable(Buffer buffer) {
        return new IllegalStateException(
                "Buffer is shared or a slice. Only exclusively owned root buffers can be modified: " + buffer + '.');
    }

    static IndexOutOfBoundsException outOfBounds(int index, int length, int size) {
        return new IndexOutOfBoundsException(
                "Access at index " + index + " of length " + length + " is out of bounds: [0 to " + size + "].");
    }
}
