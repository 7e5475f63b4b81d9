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

import io.netty.util.internal.StringUtil;

import java.util.Arrays;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A collection of utility methods that operate on {@link Buffer}s, where {@code null} stands for "no buffer".
 */
public final class BufferUtil {
    private static final char[] HEX_LOWER = "0123456789abcdef".toCharArray();
    private static final char[] HEX_UPPER = "0123456789ABCDEF".toCharArray();
    private static final int DEBUG_PREVIEW_BYTES = 16;

    private BufferUtil() {
    }

    /**
     * Retain the given buffer, if there is one.
     *
     * @return The given buffer.
     */
    public static Buffer retain(Buffer buffer) {
        return buffer == null? null : buffer.retain();
    }

    /**
     * Release the given buffer, if there is one.
     */
    public static void release(Buffer buffer) {
        if (buffer != null) {
            buffer.release();
        }
    }

    /**
     * Returns {@code true} if and only if the two buffers have the same size and the same bytes.
     * Two {@code null} buffers are equal; a {@code null} buffer is not equal to any other buffer.
     */
    public static boolean equals(Buffer a, Buffer b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        int size = a.size();
        if (size != b.size()) {
            return false;
        }
        if (a instanceof ArrayBuffer && b instanceof ArrayBuffer) {
            ArrayBuffer x = (ArrayBuffer) a;
            ArrayBuffer y = (ArrayBuffer) b;
            return Arrays.equals(x.array(), x.arrayOffset(), x.arrayOffset() + size,
                                 y.array(), y.arrayOffset(), y.arrayOffset() + size);
        }
        for (int i = 0; i < size; i++) {
            if (a.getByte(i) != b.getByte(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compare the two buffers lexicographically, treating bytes as unsigned values.
     * When one buffer is a prefix of the other, the shorter buffer is less.
     * A {@code null} buffer is less than any other buffer, and equal to another {@code null}.
     *
     * @return {@code -1}, {@code 0} or {@code 1} as the first buffer is less than, equal to, or greater than the second.
     */
    public static int compare(Buffer a, Buffer b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        int sizeA = a.size();
        int sizeB = b.size();
        if (a instanceof ArrayBuffer && b instanceof ArrayBuffer) {
            ArrayBuffer x = (ArrayBuffer) a;
            ArrayBuffer y = (ArrayBuffer) b;
            return Integer.signum(Arrays.compareUnsigned(x.array(), x.arrayOffset(), x.arrayOffset() + sizeA,
                                                         y.array(), y.arrayOffset(), y.arrayOffset() + sizeB));
        }
        int common = Math.min(sizeA, sizeB);
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(a.getUnsignedByte(i), b.getUnsignedByte(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.signum(Integer.compare(sizeA, sizeB));
    }

    /**
     * Calculates a hash code of the contents of the given buffer, consistent with {@link #equals(Buffer, Buffer)}.
     */
    public static int hashCode(Buffer buffer) {
        int size = buffer.size();
        int hash = 1;
        for (int i = 0; i < size; i++) {
            hash = 31 * hash + buffer.getByte(i);
        }
        return hash;
    }

    public static String hexDump(Buffer buffer) {
        return hexDump(buffer, false);
    }

    /**
     * Returns a hex dump of the contents of the given buffer, two digits per byte, without separators.
     */
    public static String hexDump(Buffer buffer, boolean upperCase) {
        checkNotNull(buffer, "buffer");
        return new String(hexChars(buffer, upperCase));
    }

    /**
     * Encode the contents of the given buffer as hexadecimal text, in a new buffer of ASCII bytes.
     *
     * @return A new buffer with a size of twice the size of the given buffer.
     */
    public static Buffer toHex(BufferAllocator allocator, Buffer buffer, boolean upperCase) {
        checkNotNull(allocator, "allocator");
        checkNotNull(buffer, "buffer");
        char[] chars = hexChars(buffer, upperCase);
        byte[] text = new byte[chars.length];
        for (int i = 0; i < chars.length; i++) {
            text[i] = (byte) chars[i];
        }
        return allocator.adopt(text, text.length);
    }

    /**
     * Decode the given hexadecimal text into a new buffer. Both upper and lower case digits are accepted.
     *
     * @return The decoded bytes, or {@code null} if the text is {@code null}, has an odd length,
     * or contains anything but hex digits.
     */
    public static Buffer fromHex(BufferAllocator allocator, CharSequence hex) {
        checkNotNull(allocator, "allocator");
        if (hex == null || (hex.length() & 1) != 0) {
            return null;
        }
        byte[] bytes = new byte[hex.length() >>> 1];
        for (int i = 0; i < bytes.length; i++) {
            int high = StringUtil.decodeHexNibble(hex.charAt(i << 1));
            int low = StringUtil.decodeHexNibble(hex.charAt((i << 1) + 1));
            if (high < 0 || low < 0) {
                return null;
            }
            bytes[i] = (byte) (high << 4 | low);
        }
        return allocator.adopt(bytes, bytes.length);
    }

    /**
     * Decode a buffer of ASCII hexadecimal text into a new buffer.
     *
     * @see #fromHex(BufferAllocator, CharSequence)
     */
    public static Buffer fromHex(BufferAllocator allocator, Buffer hex) {
        if (hex == null) {
            return null;
        }
        byte[] text = hex.toByteArray();
        char[] chars = new char[text.length];
        for (int i = 0; i < text.length; i++) {
            chars[i] = (char) (text[i] & 0xFF);
        }
        return fromHex(allocator, new String(chars));
    }

    /**
     * Describe the size, capacity and reference count of the given buffer, followed by a preview of its first bytes.
     * This method never throws and never modifies the buffer.
     *
     * @param buffer The buffer to describe, or {@code null}.
     * @param label The name to print the description under, or {@code null} for {@code "buffer"}.
     * @return The description, which may span two lines.
     */
    public static String debugString(Buffer buffer, String label) {
        String name = label == null? "buffer" : label;
        if (buffer == null) {
            return name + ": NULL";
        }
        if (!buffer.isAccessible()) {
            return name + ": closed";
        }
        int size = buffer.size();
        StringBuilder sb = new StringBuilder(name)
                .append(": size=").append(size)
                .append(", capacity=").append(buffer.capacity())
                .append(", refCount=").append(buffer.refCount());
        if (buffer.isSlice()) {
            sb.append(", slice");
        }
        if (size > 0) {
            sb.append(StringUtil.NEWLINE).append("  data:");
            int preview = Math.min(size, DEBUG_PREVIEW_BYTES);
            for (int i = 0; i < preview; i++) {
                sb.append(' ').append(StringUtil.byteToHexStringPadded(buffer.getUnsignedByte(i)));
            }
            if (size > DEBUG_PREVIEW_BYTES) {
                sb.append(" ... (").append(size - DEBUG_PREVIEW_BYTES).append(" more bytes)");
            }
        }
        return sb.toString();
    }

    private static char[] hexChars(Buffer buffer, boolean upperCase) {
        char[] digits = upperCase? HEX_UPPER : HEX_LOWER;
        int size = buffer.size();
        BufferAllocator.checkSize(size * 2L);
        char[] chars = new char[size << 1];
        for (int i = 0; i < size; i++) {
            int b = buffer.getUnsignedByte(i);
            chars[i << 1] = digits[b >>> 4];
            chars[(i << 1) + 1] = digits[b & 0x0F];
        }
        return chars;
    }
}
