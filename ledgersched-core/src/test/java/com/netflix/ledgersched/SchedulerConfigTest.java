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

import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.function.Supplier;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SchedulerConfigTest {

    @Test
    public void testDefaults() throws Exception {
        SchedulerConfig config = new SchedulerConfig.Builder().build();
        Assert.assertEquals(ResourceVector.of(500, 250, 300, 20), config.getVMCapacity());
        Assert.assertEquals(0.7, config.getCurrentUsageWeight(), 0.0);
        Assert.assertEquals(0.3, config.getHistoricalUsageWeight(), 0.0);
        Assert.assertEquals(1e-6, config.getEpsilon(), 0.0);
        Assert.assertEquals(10, config.getHistoryWindow());
        Assert.assertEquals(5, config.getLedgerBlockSize());
    }

    @Test
    public void testCreateVMs() throws Exception {
        ResourceVector capacity = ResourceVector.of(8, 16, 4, 10);
        List<VirtualMachine> vms = new SchedulerConfig.Builder().withVMCapacity(capacity).build().createVMs(3);
        Assert.assertEquals(3, vms.size());
        for (int i = 0; i < vms.size(); i++) {
            Assert.assertEquals(i, vms.get(i).getId());
            Assert.assertEquals(capacity, vms.get(i).getCapacity());
            Assert.assertEquals(0.0, vms.get(i).loadScore(), 0.0);
        }
    }

    @Test
    public void testInvalidValuesRejected() throws Exception {
        SchedulerConfig.Builder builder = new SchedulerConfig.Builder();
        try {
            builder.withHistoryWindow(0);
            Assert.fail("Expected IllegalArgumentException for window 0");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            builder.withLedgerBlockSize(0);
            Assert.fail("Expected IllegalArgumentException for block size 0");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            builder.withCurrentUsageWeight(-0.1);
            Assert.fail("Expected IllegalArgumentException for negative alpha");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            builder.withEpsilon(0.0);
            Assert.fail("Expected IllegalArgumentException for epsilon 0");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            builder.withVMCapacity(null).build();
            Assert.fail("Expected IllegalArgumentException for null capacity");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTimeSupplierReachesLedger() throws Exception {
        Supplier<Long> clock = mock(Supplier.class);
        when(clock.get()).thenReturn(1_000_000L);
        SchedulerConfig config = new SchedulerConfig.Builder().withTimeSupplier(clock).build();
        SchedulerRegistry registry = new SchedulerRegistry(config);
        registry.getPolicy(SchedulingPolicyType.BLOCKCHAIN_INSPIRED);
        // the genesis block takes its timestamp from the configured clock
        verify(clock).get();
    }
}
