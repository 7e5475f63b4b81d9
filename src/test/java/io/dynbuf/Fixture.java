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

import java.util.function.Supplier;

public final class Fixture implements Supplier<BufferAllocator> {
    private final String name;
    private final Supplier<BufferAllocator> factory;

    public Fixture(String name, Supplier<BufferAllocator> factory) {
        this.name = name;
        this.factory = factory;
    }

    public BufferAllocator createAllocator() {
        return factory.get();
    }

    @Override
    public BufferAllocator get() {
        return factory.get();
    }

    @Override
    public String toString() {
        return name;
    }
}
