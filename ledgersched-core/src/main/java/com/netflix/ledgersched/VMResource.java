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

/**
 * The resource dimensions tracked for every virtual machine. Each dimension has a short key that is used when
 * resource amounts are rendered as JSON, in ledger records and in their hashes.
 */
public enum VMResource {
    CPU("cpu"),
    Memory("mem"),
    IO("io"),
    Network("bw");

    private final String key;

    VMResource(String key) {
        this.key = key;
    }

    /**
     * Get the short key of this resource, for example {@code "cpu"} or {@code "bw"}.
     *
     * @return the key
     */
    public String getKey() {
        return key;
    }

    /**
     * Find the resource with the given short key.
     *
     * @param key the short key
     * @return the matching resource
     * @throws IllegalArgumentException if no resource has that key
     */
    public static VMResource fromKey(String key) {
        for (VMResource r : values()) {
            if (r.key.equals(key))
                return r;
        }
        throw new IllegalArgumentException("Unknown resource key: " + key);
    }
}
