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

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;

/**
 * Fixed-width primitive access into byte arrays, in an explicit byte order.
 * <p>
 * None of these methods do bounds checking beyond what the JVM does for array access.
 */
public final class ByteArrayAccess {
    private static final VarHandle SHORT_BE = MethodHandles.byteArrayViewVarHandle(short[].class, ByteOrder.BIG_ENDIAN);
    private static final VarHandle SHORT_LE =
            MethodHandles.byteArrayViewVarHandle(short[].class, ByteOrder.LITTLE_ENDIAN);
    private static final VarHandle INT_BE = MethodHandles.byteArrayViewVarHandle(int[].class, ByteOrder.BIG_ENDIAN);
    private static final VarHandle INT_LE = MethodHandles.byteArrayViewVarHandle(int[].class, ByteOrder.LITTLE_ENDIAN);
    private static final VarHandle LONG_BE = MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.BIG_ENDIAN);
    private static final VarHandle LONG_LE =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.LITTLE_ENDIAN);

    private ByteArrayAccess() {
    }

    public static short getShort(byte[] array, int index, ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN? (short) SHORT_BE.get(array, index) : (short) SHORT_LE.get(array, index);
    }

    public static void setShort(byte[] array, int index, short value, ByteOrder order) {
        if (order == ByteOrder.BIG_ENDIAN) {
            SHORT_BE.set(array, index, value);
        } else {
            SHORT_LE.set(array, index, value);
        }
    }

    public static int getInt(byte[] array, int index, ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN? (int) INT_BE.get(array, index) : (int) INT_LE.get(array, index);
    }

    public static void setInt(byte[] array, int index, int value, ByteOrder order) {
        if (order == ByteOrder.BIG_ENDIAN) {
            INT_BE.set(array, index, value);
        } else {
            INT_LE.set(array, index, value);
        }
    }

    public static long getLong(byte[] array, int index, ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN? (long) LONG_BE.get(array, index) : (long) LONG_LE.get(array, index);
    }

    public static void setLong(byte[] array, int index, long value, ByteOrder order) {
        if (order == ByteOrder.BIG_ENDIAN) {
            LONG_BE.set(array, index, value);
        } else {
            LONG_LE.set(array, index, value);
        }
    }
}
