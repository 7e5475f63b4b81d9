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
package io.dynbuf.nio;

import io.dynbuf.Buffer;
import io.dynbuf.BufferAllocator;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Moves the contents of {@link Buffer}s to and from files and streams.
 * <p>
 * A file that does not exist, or that may not be accessed, is reported through the return value.
 * Other I/O failures are thrown.
 */
public final class BufferFiles {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(BufferFiles.class);

    private BufferFiles() {
    }

    /**
     * Read the whole file into a new buffer, with a capacity equal to the file size.
     *
     * @param allocator The allocator of the new buffer.
     * @param path The file to read.
     * @return The new buffer, or {@code null} if the file does not exist or may not be read.
     * @throws IOException if reading the file fails for another reason.
     */
    public static Buffer readFile(BufferAllocator allocator, Path path) throws IOException {
        checkNotNull(allocator, "allocator");
        checkNotNull(path, "path");
        byte[] contents;
        try {
            contents = Files.readAllBytes(path);
        } catch (NoSuchFileException | AccessDeniedException e) {
            logger.debug("Cannot read {}: {}", path, e.toString());
            return null;
        }
        return allocator.adopt(contents, contents.length);
    }

    /**
     * Write the contents of the buffer to the file, replacing any existing contents.
     *
     * @param buffer The buffer to write.
     * @param path The file to write. It is created if it does not exist.
     * @return {@code true} if all bytes were written, or {@code false} if the parent directory does not exist or the
     * file may not be written.
     * @throws IOException if writing the file fails for another reason.
     */
    public static boolean writeFile(Buffer buffer, Path path) throws IOException {
        checkNotNull(buffer, "buffer");
        checkNotNull(path, "path");
        FileChannel channel;
        try {
            channel = FileChannel.open(path, WRITE, CREATE, TRUNCATE_EXISTING);
        } catch (NoSuchFileException | AccessDeniedException e) {
            logger.debug("Cannot write {}: {}", path, e.toString());
            return false;
        }
        try (FileChannel ch = channel) {
            return buffer.transferTo(ch) == buffer.size();
        }
    }

    /**
     * Append up to {@code maxBytes} bytes from the stream to the buffer. A single read is made.
     *
     * @param maxBytes The most bytes to read, or zero for a default chunk size.
     * @return The number of bytes read, {@code 0} at the end of the stream,
     * or {@code -1} if the buffer is not {@linkplain Buffer#isWritable() writable}.
     * @see Buffer#transferFrom(java.nio.channels.ReadableByteChannel, int)
     */
    public static int readFrom(Buffer buffer, InputStream in, int maxBytes) throws IOException {
        checkNotNull(buffer, "buffer");
        checkNotNull(in, "in");
        return buffer.transferFrom(Channels.newChannel(in), maxBytes);
    }

    /**
     * Write all the bytes of the buffer to the stream.
     *
     * @return The number of bytes written.
     */
    public static int writeTo(Buffer buffer, OutputStream out) throws IOException {
        checkNotNull(buffer, "buffer");
        checkNotNull(out, "out");
        return buffer.transferTo(Channels.newChannel(out));
    }
}
