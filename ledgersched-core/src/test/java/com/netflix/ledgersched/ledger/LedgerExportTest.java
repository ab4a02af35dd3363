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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.ledgersched.ResourceVector;
import com.netflix.ledgersched.TaskRequest;
import com.netflix.ledgersched.TaskRequestProvider;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;

public class LedgerExportTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final AtomicLong clock = new AtomicLong(5_000L);
    private TransactionLedger ledger;

    @Before
    public void setUp() throws Exception {
        ledger = new TransactionLedger(3, clock::get);
        for (int i = 0; i < 11; i++) {
            clock.addAndGet(100L);
            TaskRequest task = TaskRequestProvider.getTaskRequest("task" + i, 1.5, 2, 0.25, 1, 10_000L);
            ResourceVector before = ResourceVector.of(i, i, 0, 0);
            if (i % 4 == 3)
                ledger.append(i % 2, task, before, before, 0.0, TransactionStatus.FAILED);
            else
                ledger.append(i % 2, task, before, before.plus(task.getDemand()), 0.1 * i, TransactionStatus.ASSIGNED);
        }
        // 3 blocks mined besides genesis, 2 pending
    }

    private String tamper(String json, String... pathAndValue) throws Exception {
        JsonNode root = mapper.readTree(json);
        JsonNode node = root;
        for (int i = 0; i < pathAndValue.length - 2; i++) {
            String step = pathAndValue[i];
            node = step.matches("\\d+") ? node.get(Integer.parseInt(step)) : node.get(step);
        }
        String field = pathAndValue[pathAndValue.length - 2];
        String value = pathAndValue[pathAndValue.length - 1];
        if (value.matches("-?\\d+(\\.\\d+)?"))
            ((ObjectNode) node).put(field, Double.parseDouble(value));
        else
            ((ObjectNode) node).put(field, value);
        return mapper.writeValueAsString(root);
    }

    @Test
    public void testRestoreUntampered() throws Exception {
        String json = ledger.export().toJson();
        TransactionLedger restored = TransactionLedger.restore(LedgerExport.fromJson(json), 3, clock::get);
        assertThat(restored.verifyIntegrity(), is(true));
        assertThat(restored.getBlocks().size(), is(4));
        assertThat(restored.getPendingTransactions().size(), is(2));
        assertThat(restored.summary().getLatestBlockHash(), equalTo(ledger.summary().getLatestBlockHash()));
        assertThat(restored.summary().getSuccessfulAssignments(), is(9));

        // appending continues the chain and the id sequence
        String id = restored.append(0, TaskRequestProvider.getTaskRequest(1, 1, 1, 1, 0L), ResourceVector.ZERO,
                ResourceVector.ZERO, 0.0, TransactionStatus.REJECTED);
        assertThat(id, equalTo("tx_12_" + clock.get()));
        assertThat(restored.getBlocks().size(), is(5));
        assertThat(restored.verifyIntegrity(), is(true));
    }

    @Test
    public void testExportShape() throws Exception {
        JsonNode root = mapper.readTree(ledger.export().toJson());
        assertThat(root.get("blocks").size(), is(4));
        JsonNode tx = root.get("blocks").get(1).get("transactions").get(0);
        assertThat(tx.get("transactionId").asText(), equalTo("tx_1_5100"));
        assertThat(tx.get("status").asText(), equalTo("assigned"));
        assertThat(tx.get("taskRequirements").get("cpu").asDouble(), is(1.5));
        assertThat(tx.get("blockHash").asText(), equalTo(root.get("blocks").get(1).get("blockHash").asText()));
        assertThat(root.get("pendingTransactions").size(), is(2));
        assertThat(root.get("summary").get("chainIntegrity").asBoolean(), is(true));
    }

    @Test
    public void testTamperedBlockHash() throws Exception {
        assertTampered(tamper(ledger.export().toJson(), "blocks", "1", "blockHash", "ab12"), 1L);
    }

    @Test
    public void testTamperedPreviousHash() throws Exception {
        assertTampered(tamper(ledger.export().toJson(), "blocks", "2", "previousHash", "deadbeef"), 2L);
    }

    @Test
    public void testTamperedTransactionField() throws Exception {
        assertTampered(tamper(ledger.export().toJson(), "blocks", "1", "transactions", "1", "score", "42.0"), 1L);
    }

    @Test
    public void testTamperedTransactionState() throws Exception {
        assertTampered(tamper(ledger.export().toJson(),
                "blocks", "3", "transactions", "0", "vmStateAfter", "cpu", "0.0"), 3L);
    }

    @Test
    public void testTamperedTransactionStamp() throws Exception {
        assertTampered(tamper(ledger.export().toJson(), "blocks", "2", "transactions", "2", "blockHash", ""), 2L);
    }

    @Test
    public void testTamperedGenesis() throws Exception {
        assertTampered(tamper(ledger.export().toJson(), "blocks", "0", "previousHash", "f00"), 0L);
    }

    @Test
    public void testNoBlocks() throws Exception {
        try {
            TransactionLedger.restore(new LedgerExport(Collections.<LedgerBlock>emptyList(), null, null), 3);
            fail("Expected LedgerIntegrityException");
        } catch (LedgerIntegrityException e) {
            assertThat(e.getBlockId(), is(-1L));
        }
    }

    @Test(expected = MalformedRecordException.class)
    public void testCorruptJson() throws Exception {
        LedgerExport.fromJson("{\"blocks\": [ {\"blockId\": ");
    }

    @Test(expected = MalformedRecordException.class)
    public void testUnknownResourceKey() throws Exception {
        String json = tamper(ledger.export().toJson(), "blocks", "1", "transactions", "0", "taskRequirements", "gpu", "1.0");
        LedgerExport.fromJson(json);
    }

    @Test(expected = MalformedRecordException.class)
    public void testEmptyJson() throws Exception {
        LedgerExport.fromJson("");
    }

    @Test
    public void testExportUnaffectedByLaterMining() throws Exception {
        TransactionLedger source = new TransactionLedger(2, clock::get);
        source.append(0, TaskRequestProvider.getTaskRequest("a", 1, 1, 1, 1, 0L), ResourceVector.ZERO,
                ResourceVector.of(1, 1, 1, 1), 0.5, TransactionStatus.ASSIGNED);
        LedgerExport export = source.export();

        // fills the block on the source ledger
        source.append(1, TaskRequestProvider.getTaskRequest("b", 1, 1, 1, 1, 0L), ResourceVector.ZERO,
                ResourceVector.of(1, 1, 1, 1), 0.5, TransactionStatus.ASSIGNED);
        assertThat(source.getBlocks().size(), is(2));
        assertThat(export.getPendingTransactions().size(), is(1));
        assertThat(export.getPendingTransactions().get(0).getBlockHash(), equalTo(""));

        TransactionLedger restored = TransactionLedger.restore(export, 2, clock::get);
        assertThat(restored.getBlocks().size(), is(1));
        assertThat(restored.getPendingTransactions().size(), is(1));
        LedgerBlock mined = restored.mine();
        assertThat(mined.getTransactions().get(0).getBlockHash(), equalTo(mined.getBlockHash()));
        assertThat(export.getPendingTransactions().get(0).getBlockHash(), equalTo(""));
        assertThat(restored.verifyIntegrity(), is(true));
        assertThat(source.verifyIntegrity(), is(true));
    }

    @Test
    public void testRestoredLedgerMinesIndependently() throws Exception {
        TransactionLedger source = new TransactionLedger(5, clock::get);
        source.append(0, TaskRequestProvider.getTaskRequest("a", 1, 1, 1, 1, 0L), ResourceVector.ZERO,
                ResourceVector.of(1, 1, 1, 1), 0.5, TransactionStatus.ASSIGNED);
        TransactionLedger copy = TransactionLedger.restore(source.export(), 5, clock::get);
        LedgerBlock sourceBlock = source.mine();
        clock.addAndGet(10L);
        LedgerBlock copyBlock = copy.mine();
        assertThat(copyBlock.getTransactions().get(0).getBlockHash(), equalTo(copyBlock.getBlockHash()));
        assertThat(sourceBlock.getTransactions().get(0).getBlockHash(), equalTo(sourceBlock.getBlockHash()));
        assertThat(source.verifyIntegrity(), is(true));
        assertThat(copy.verifyIntegrity(), is(true));
    }

    @Test(expected = MalformedRecordException.class)
    public void testNullBlockRejected() throws Exception {
        TransactionLedger.restore(LedgerExport.fromJson("{\"blocks\":[null],\"pendingTransactions\":[]}"), 5);
    }

    @Test(expected = MalformedRecordException.class)
    public void testNullPendingTransactionRejected() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(ledger.export().toJson());
        ((ArrayNode) root.get("pendingTransactions")).addNull();
        TransactionLedger.restore(LedgerExport.fromJson(mapper.writeValueAsString(root)), 3);
    }

    @Test
    public void testMissingTaskRequirementsRejected() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(ledger.export().toJson());
        ((ObjectNode) root.get("blocks").get(2).get("transactions").get(1)).remove("taskRequirements");
        LedgerExport export = LedgerExport.fromJson(mapper.writeValueAsString(root));
        try {
            TransactionLedger.restore(export, 3, clock::get);
            fail("Expected MalformedRecordException");
        } catch (MalformedRecordException e) {
            assertThat(e.getMessage().contains("block 2"), is(true));
        }
    }

    private void assertTampered(String json, long expectedBlockId) throws Exception {
        LedgerExport export = LedgerExport.fromJson(json);
        assertThat(TransactionLedger.rebuild(export, 3, clock::get).verifyIntegrity(), is(false));
        try {
            TransactionLedger.restore(export, 3, clock::get);
            fail("Expected LedgerIntegrityException");
        } catch (LedgerIntegrityException e) {
            assertThat(e.getBlockId(), is(expectedBlockId));
        }
    }
}
