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
 * Assignment statistics of one VM, computed from every transaction in a ledger, mined or pending.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VmLedgerStats {
    private final int vmId;
    private final int totalAssignments;
    private final int failedAssignments;
    private final double successRate;
    private final double averageScore;
    private final double totalCpuAllocated;
    private final double totalMemAllocated;
    private final int totalTransactions;

    @JsonCreator
    public VmLedgerStats(@JsonProperty("vmId") int vmId,
                         @JsonProperty("totalAssignments") int totalAssignments,
                         @JsonProperty("failedAssignments") int failedAssignments,
                         @JsonProperty("successRate") double successRate,
                         @JsonProperty("averageScore") double averageScore,
                         @JsonProperty("totalCpuAllocated") double totalCpuAllocated,
                         @JsonProperty("totalMemAllocated") double totalMemAllocated,
                         @JsonProperty("totalTransactions") int totalTransactions) {
        this.vmId = vmId;
        this.totalAssignments = totalAssignments;
        this.failedAssignments = failedAssignments;
        this.successRate = successRate;
        this.averageScore = averageScore;
        this.totalCpuAllocated = totalCpuAllocated;
        this.totalMemAllocated = totalMemAllocated;
        this.totalTransactions = totalTransactions;
    }

    public int getVmId() {
        return vmId;
    }

    /**
     * Get the number of {@link TransactionStatus#ASSIGNED} transactions for the VM.
     *
     * @return the number of assignments
     */
    public int getTotalAssignments() {
        return totalAssignments;
    }

    public int getFailedAssignments() {
        return failedAssignments;
    }

    /**
     * Get assignments divided by assignments plus failures, or by 1 when there are neither.
     *
     * @return the success rate
     */
    public double getSuccessRate() {
        return successRate;
    }

    /**
     * Get the mean score over the VM's assignments.
     *
     * @return the mean score, 0 when there are no assignments
     */
    public double getAverageScore() {
        return averageScore;
    }

    public double getTotalCpuAllocated() {
        return totalCpuAllocated;
    }

    public double getTotalMemAllocated() {
        return totalMemAllocated;
    }

    public int getTotalTransactions() {
        return totalTransactions;
    }

    @Override
    public String toString() {
        return "VmLedgerStats{" +
                "vmId=" + vmId +
                ", totalAssignments=" + totalAssignments +
                ", failedAssignments=" + failedAssignments +
                ", successRate=" + successRate +
                ", averageScore=" + averageScore +
                ", totalCpuAllocated=" + totalCpuAllocated +
                ", totalMemAllocated=" + totalMemAllocated +
                ", totalTransactions=" + totalTransactions +
                '}';
    }
}
