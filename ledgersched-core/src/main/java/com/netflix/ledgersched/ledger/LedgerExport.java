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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A full snapshot of a {@link TransactionLedger}: every block with its transactions, the pending transactions and
 * the summary. Its JSON form, from {@link #toJson()}, is what presentation layers consume.
 * <p>
 * An export read back with {@link #fromJson(String)} can be turned into a ledger again with
 * {@link TransactionLedger#restore(LedgerExport, int)}, which verifies the chain first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerExport {
    static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<LedgerBlock> blocks;
    private final List<SchedulingTransaction> pendingTransactions;
    private final LedgerSummary summary;

    @JsonCreator
    public LedgerExport(@JsonProperty("blocks") List<LedgerBlock> blocks,
                        @JsonProperty("pendingTransactions") List<SchedulingTransaction> pendingTransactions,
                        @JsonProperty("summary") LedgerSummary summary) {
        this.blocks = blocks == null ?
                Collections.<LedgerBlock>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(blocks));
        this.pendingTransactions = pendingTransactions == null ?
                Collections.<SchedulingTransaction>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(pendingTransactions));
        this.summary = summary;
    }

    public List<LedgerBlock> getBlocks() {
        return blocks;
    }

    public List<SchedulingTransaction> getPendingTransactions() {
        return pendingTransactions;
    }

    public LedgerSummary getSummary() {
        return summary;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Can't write ledger export: " + e.getMessage(), e);
        }
    }

    /**
     * Read an export from its JSON form.
     *
     * @param json the JSON written by {@link #toJson()}
     * @return the export
     * @throws MalformedRecordException if the JSON can't be read as a ledger export
     */
    public static LedgerExport fromJson(String json) {
        if (json == null || json.isEmpty())
            throw new MalformedRecordException("Empty ledger export");
        try {
            return objectMapper.readValue(json, LedgerExport.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedRecordException("Can't read ledger export: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "LedgerExport{" +
                "blocks=" + blocks.size() +
                ", pendingTransactions=" + pendingTransactions.size() +
                ", summary=" + summary +
                '}';
    }
}
