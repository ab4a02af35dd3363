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

package com.netflix.ledgersched.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome recorded by a {@link SchedulingTransaction}.
 */
public enum TransactionStatus {
    ASSIGNED("assigned"),
    FAILED("failed"),
    REJECTED("rejected");

    private final String key;

    TransactionStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static TransactionStatus fromKey(String key) {
        for (TransactionStatus s : values()) {
            if (s.key.equals(key))
                return s;
        }
        throw new IllegalArgumentException("Unknown transaction status: " + key);
    }
}
