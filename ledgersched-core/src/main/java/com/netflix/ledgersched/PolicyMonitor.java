/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.ledgersched;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A monitor that serializes scheduling calls on one policy instance. Cursor advances, history updates and
 * ledger appends of one call never interleave with those of another.
 */
class PolicyMonitor {

    interface Entry extends AutoCloseable {
        @Override
        void close();
    }

    private final ReentrantLock lock;

    PolicyMonitor() {
        lock = new ReentrantLock(true);
    }

    Entry enter() {
        lock.lock();
        return new Entry() {
            @Override
            public void close() {
                if(!lock.isHeldByCurrentThread())
                    throw new IllegalStateException("Policy monitor not held by " + Thread.currentThread().getName());
                lock.unlock();
            }
        };
    }
}
