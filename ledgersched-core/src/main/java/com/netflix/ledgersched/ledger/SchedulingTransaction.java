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
import com.netflix.ledgersched.ResourceVector;

/**
 * One scheduling outcome recorded in a {@link TransactionLedger}: which task went (or failed to go) to which VM,
 * the VM's usage before and after, and the policy's score.
 * <p>
 * A transaction does not change after it is created, except that the hash of the block it is mined into is
 * stamped on it once, when the block is mined.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchedulingTransaction {
    private final String transactionId;
    private final long timestamp;
    private final int vmId;
    private final String taskId;
    private final ResourceVector taskRequirements;
    private final ResourceVector vmStateBefore;
    private final ResourceVector vmStateAfter;
    private final double score;
    private final TransactionStatus status;
    private volatile String blockHash;

    @JsonCreator
    public SchedulingTransaction(@JsonProperty("transactionId") String transactionId,
                                 @JsonProperty("timestamp") long timestamp,
                                 @JsonProperty("vmId") int vmId,
                                 @JsonProperty("taskId") String taskId,
                                 @JsonProperty("taskRequirements") ResourceVector taskRequirements,
                                 @JsonProperty("vmStateBefore") ResourceVector vmStateBefore,
                                 @JsonProperty("vmStateAfter") ResourceVector vmStateAfter,
                                 @JsonProperty("score") double score,
                                 @JsonProperty("status") TransactionStatus status,
                                 @JsonProperty("blockHash") String blockHash) {
        this.transactionId = transactionId;
        this.timestamp = timestamp;
        this.vmId = vmId;
        this.taskId = taskId;
        this.taskRequirements = taskRequirements;
        this.vmStateBefore = vmStateBefore;
        this.vmStateAfter = vmStateAfter;
        this.score = score;
        this.status = status;
        this.blockHash = blockHash == null ? "" : blockHash;
    }

    /**
     * Copy a transaction, block hash included. The copy is stamped independently of the original.
     */
    SchedulingTransaction(SchedulingTransaction other) {
        this(other.transactionId, other.timestamp, other.vmId, other.taskId, other.taskRequirements,
                other.vmStateBefore, other.vmStateAfter, other.score, other.status, other.blockHash);
    }

    public String getTransactionId() {
        return transactionId;
    }

    /**
     * Get the time the transaction was appended to the ledger.
     *
     * @return milliseconds since the epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    public int getVmId() {
        return vmId;
    }

    public String getTaskId() {
        return taskId;
    }

    public ResourceVector getTaskRequirements() {
        return taskRequirements;
    }

    public ResourceVector getVmStateBefore() {
        return vmStateBefore;
    }

    public ResourceVector getVmStateAfter() {
        return vmStateAfter;
    }

    public double getScore() {
        return score;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    /**
     * Get the hash of the block this transaction was mined into.
     *
     * @return the block hash, or an empty string while the transaction is pending
     */
    public String getBlockHash() {
        return blockHash;
    }

    void stampBlockHash(String hash) {
        if (!blockHash.isEmpty())
            throw new IllegalStateException("Transaction " + transactionId + " already mined into block " + blockHash);
        blockHash = hash;
    }

    @Override
    public String toString() {
        return "SchedulingTransaction{" +
                "transactionId='" + transactionId + '\'' +
                ", timestamp=" + timestamp +
                ", vmId=" + vmId +
                ", taskId='" + taskId + '\'' +
                ", taskRequirements=" + taskRequirements +
                ", vmStateBefore=" + vmStateBefore +
                ", vmStateAfter=" + vmStateAfter +
                ", score=" + score +
                ", status=" + status +
                ", blockHash='" + blockHash + '\'' +
                '}';
    }
}
