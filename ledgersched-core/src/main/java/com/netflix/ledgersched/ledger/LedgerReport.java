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

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A dashboard view of a ledger: its summary, the most recent transactions, statistics for the VMs seen in recent
 * transactions and the full export.
 */
public class LedgerReport {
    private final LedgerSummary summary;
    private final List<SchedulingTransaction> recentTransactions;
    private final Map<Integer, VmLedgerStats> vmStats;
    private final LedgerExport exportData;

    LedgerReport(LedgerSummary summary, List<SchedulingTransaction> recentTransactions,
                 Map<Integer, VmLedgerStats> vmStats, LedgerExport exportData) {
        this.summary = summary;
        this.recentTransactions = Collections.unmodifiableList(recentTransactions);
        this.vmStats = Collections.unmodifiableMap(vmStats);
        this.exportData = exportData;
    }

    public LedgerSummary getSummary() {
        return summary;
    }

    public List<SchedulingTransaction> getRecentTransactions() {
        return recentTransactions;
    }

    /**
     * Get statistics per VM id, for every VM that appears in the recent transactions scanned for the report.
     *
     * @return VM id to statistics, in ascending VM id order
     */
    public Map<Integer, VmLedgerStats> getVmStats() {
        return vmStats;
    }

    public LedgerExport getExportData() {
        return exportData;
    }

    public String toJson() {
        try {
            return LedgerExport.objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Can't write ledger report: " + e.getMessage(), e);
        }
    }
}
