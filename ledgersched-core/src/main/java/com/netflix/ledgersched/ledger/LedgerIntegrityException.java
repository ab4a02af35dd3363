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

/**
 * Thrown when a ledger's chain fails verification. A ledger is never repaired; the caller decides what to do.
 */
public class LedgerIntegrityException extends RuntimeException {

    private final long blockId;

    public LedgerIntegrityException(long blockId, String message) {
        super(message);
        this.blockId = blockId;
    }

    /**
     * Get the id of the first block that failed verification.
     *
     * @return the block id, or -1 if the chain has no blocks at all
     */
    public long getBlockId() {
        return blockId;
    }
}
