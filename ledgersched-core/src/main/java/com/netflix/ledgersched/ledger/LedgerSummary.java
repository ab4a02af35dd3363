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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Totals over a whole {@link TransactionLedger}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerSummary {
    private final int totalBlocks;
    private final int totalTransactions;
    private final int pendingTransactions;
    private final int successfulAssignments;
    private final int failedAssignments;
    private final double successRate;
    private final boolean chainIntegrity;
    private final String latestBlockHash;

    @JsonCreator
    public LedgerSummary(@JsonProperty("totalBlocks") int totalBlocks,
                         @JsonProperty("totalTransactions") int totalTransactions,
                         @JsonProperty("pendingTransactions") int pendingTransactions,
                         @JsonProperty("successfulAssignments") int successfulAssignments,
                         @JsonProperty("failedAssignments") int failedAssignments,
                         @JsonProperty("successRate") double successRate,
                         @JsonProperty("chainIntegrity") boolean chainIntegrity,
                         @JsonProperty("latestBlockHash") String latestBlockHash) {
        this.totalBlocks = totalBlocks;
        this.totalTransactions = totalTransactions;
        this.pendingTransactions = pendingTransactions;
        this.successfulAssignments = successfulAssignments;
        this.failedAssignments = failedAssignments;
        this.successRate = successRate;
        this.chainIntegrity = chainIntegrity;
        this.latestBlockHash = latestBlockHash;
    }

    /**
     * Get the number of blocks, including the genesis block.
     *
     * @return the number of blocks
     */
    public int getTotalBlocks() {
        return totalBlocks;
    }

    /**
     * Get the number of transactions, mined and pending.
     *
     * @return the number of transactions
     */
    public int getTotalTransactions() {
        return totalTransactions;
    }

    public int getPendingTransactions() {
        return pendingTransactions;
    }

    public int getSuccessfulAssignments() {
        return successfulAssignments;
    }

    public int getFailedAssignments() {
        return failedAssignments;
    }

    /**
     * Get successful assignments divided by all transactions, or by 1 when there are none.
     *
     * @return the success rate
     */
    public double getSuccessRate() {
        return successRate;
    }

    @JsonProperty("chainIntegrity")
    public boolean isChainIntegrity() {
        return chainIntegrity;
    }

    public String getLatestBlockHash() {
        return latestBlockHash;
    }

    @Override
    public String toString() {
        return "LedgerSummary{" +
                "totalBlocks=" + totalBlocks +
                ", totalTransactions=" + totalTransactions +
                ", pendingTransactions=" + pendingTransactions +
                ", successfulAssignments=" + successfulAssignments +
                ", failedAssignments=" + failedAssignments +
                ", successRate=" + successRate +
                ", chainIntegrity=" + chainIntegrity +
                ", latestBlockHash='" + latestBlockHash + '\'' +
                '}';
    }
}
