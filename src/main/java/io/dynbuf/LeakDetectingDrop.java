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

import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.lang.invoke.VarHandle;
import java.lang.ref.Cleaner.Cleanable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

import static io.dynbuf.internal.Statics.CLEANER;
import static io.dynbuf.internal.Statics.findVarHandle;
import static java.lang.invoke.MethodHandles.lookup;

/**
 * Reports buffers that become unreachable before their last reference is released.
 * <p>
 * The check is done with a {@link java.lang.ref.Cleaner}, which is disabled again when the buffer is dropped
 * normally. The cleaning action must not reference the buffer, or the buffer would never become unreachable.
 */
final class LeakDetectingDrop implements Drop<ArrayBuffer> {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(LeakDetectingDrop.class);
    private static final VarHandle CLEANABLE =
            findVarHandle(lookup(), LeakDetectingDrop.class, "cleanable", GatedCleanable.class);
    static final LongAdder LEAKS_DETECTED = new LongAdder();

    private final Drop<ArrayBuffer> delegate;
    @SuppressWarnings("unused")
    private volatile GatedCleanable cleanable;

    LeakDetectingDrop(Drop<ArrayBuffer> delegate) {
        this.delegate = delegate;
    }

    @Override
    public void drop(ArrayBuffer buf) {
        GatedCleanable c = (GatedCleanable) CLEANABLE.getAndSet(this, null);
        if (c != null) {
            c.disable();
            c.clean();
        }
        delegate.drop(buf);
    }

    @Override
    public void attach(ArrayBuffer buf) {
        // Unregister old cleanable, if any, to avoid uncontrolled build-up.
        GatedCleanable c = (GatedCleanable) CLEANABLE.getAndSet(this, null);
        if (c != null) {
            c.disable();
            c.clean();
        }

        AtomicBoolean gate = new AtomicBoolean(true);
        String description = (buf.isSlice()? "Slice" : "Buffer") + " of " + buf.capacity() + " bytes";
        cleanable = new GatedCleanable(gate, CLEANER.register(buf, new LeakAction(gate, description)));
        delegate.attach(buf);
    }

    @Override
    public String toString() {
        return "LeakDetectingDrop(" + delegate + ')';
    }

    private static final class LeakAction implements Runnable {
        private final AtomicBoolean gate;
        private final String description;

        private LeakAction(AtomicBoolean gate, String description) {
            this.gate = gate;
            this.description = description;
        }

        @Override
        public void run() {
            if (gate.getAndSet(false)) {
                LEAKS_DETECTED.increment();
                logger.warn("LEAK: {} was garbage collected before it was released. " +
                            "Enable -Dio.dynbuf.traceLifecycleDepth=<depth> to record where buffers are retained.",
                            description);
            }
        }
    }

    private static final class GatedCleanable implements Cleanable {
        private final AtomicBoolean gate;
        private final Cleanable cleanable;

        GatedCleanable(AtomicBoolean gate, Cleanable cleanable) {
            this.gate = gate;
            this.cleanable = cleanable;
        }

        public void disable() {
            gate.set(false);
        }

        @Override
        public void clean() {
            cleanable.clean();
        }
    }
}
