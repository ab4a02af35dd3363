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

import java.util.Arrays;
import java.util.List;
import java.util.Random;

public class VirtualMachineTest {

    private static final ResourceVector capacity = ResourceVector.of(8, 16, 4, 10);

    @Test
    public void testAdmissionOnEveryResource() throws Exception {
        VirtualMachine vm = new VirtualMachine(0, capacity);
        Assert.assertTrue(vm.canAdmit(TaskRequestProvider.getTaskRequest(8, 16, 4, 10, 0L)));
        Assert.assertFalse(vm.canAdmit(TaskRequestProvider.getTaskRequest(9, 1, 1, 1, 0L)));
        Assert.assertFalse(vm.canAdmit(TaskRequestProvider.getTaskRequest(1, 17, 1, 1, 0L)));
        Assert.assertFalse(vm.canAdmit(TaskRequestProvider.getTaskRequest(1, 1, 5, 1, 0L)));
        Assert.assertFalse(vm.canAdmit(TaskRequestProvider.getTaskRequest(1, 1, 1, 11, 0L)));
    }

    @Test
    public void testCommitAddsUsageAndTaskId() throws Exception {
        VirtualMachine vm = new VirtualMachine(3, capacity);
        TaskRequest task = TaskRequestProvider.getTaskRequest("t1", 2, 4, 1, 2, 0L);
        vm.commit(task);
        Assert.assertEquals(ResourceVector.of(2, 4, 1, 2), vm.getUsage());
        Assert.assertEquals(Arrays.asList("t1"), vm.getTaskIds());
        Assert.assertEquals(0.25, vm.utilization(VMResource.CPU), 0.0);
        Assert.assertEquals((0.25 + 0.25 + 0.25 + 0.2) / 4.0, vm.loadScore(), 1e-12);
    }

    @Test
    public void testUsageSnapshotIsDetached() throws Exception {
        VirtualMachine vm = new VirtualMachine(0, capacity);
        ResourceVector before = vm.getUsage();
        vm.commit(TaskRequestProvider.getTaskRequest(1, 1, 1, 1, 0L));
        Assert.assertEquals(ResourceVector.ZERO, before);
        Assert.assertEquals(1.0, vm.getUsed(VMResource.Memory), 0.0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testTaskIdsAreReadOnly() throws Exception {
        new VirtualMachine(0, capacity).getTaskIds().add("x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacityRejected() throws Exception {
        new VirtualMachine(0, ResourceVector.of(8, 0, 4, 10));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeUsageRejected() throws Exception {
        VMProvider.getVM(0, capacity, ResourceVector.of(-1, 0, 0, 0));
    }

    // after any sequence of admission-checked commits, usage stays within capacity
    @Test
    public void testCheckedCommitsNeverExceedCapacity() throws Exception {
        Random random = new Random(42);
        List<VirtualMachine> vms = VMProvider.getVMs(3, 8, 16, 4, 10);
        for (int i = 0; i < 500; i++) {
            TaskRequest task = TaskRequestProvider.getTaskRequest(random.nextInt(4), random.nextInt(6),
                    random.nextInt(3), random.nextInt(4), 0L);
            VirtualMachine vm = vms.get(random.nextInt(vms.size()));
            if (vm.canAdmit(task))
                vm.commit(task);
        }
        for (VirtualMachine vm : vms) {
            for (VMResource r : VMResource.values())
                Assert.assertTrue(vm.getUsed(r) <= vm.getCapacity().get(r));
            Assert.assertTrue(vm.loadScore() >= 0.0 && vm.loadScore() <= 1.0);
        }
    }

    @Test
    public void testTaskRequestValidation() throws Exception {
        try {
            new TaskRequest.Builder("").withDeadline(1L).build();
            Assert.fail("Empty id should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new TaskRequest.Builder("t").build();
            Assert.fail("Missing deadline should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new TaskRequest.Builder("t").withDeadline(1L).withCPU(-1).build();
            Assert.fail("Negative demand should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
        TaskRequest task = new TaskRequest.Builder("t").withDeadline(1L).withDurationMillis(5000L).build();
        Assert.assertTrue(task.hasDuration());
        Assert.assertEquals(ResourceVector.ZERO, task.getDemand());
    }

    @Test
    public void testResourceVectorKeys() throws Exception {
        ResourceVector v = ResourceVector.of(1, 2, 3, 4);
        Assert.assertEquals(4.0, v.asKeyedMap().get("bw"), 0.0);
        Assert.assertEquals(v, ResourceVector.fromKeyedMap(v.asKeyedMap()));
        Assert.assertEquals(VMResource.Network, VMResource.fromKey("bw"));
        Assert.assertEquals(ResourceVector.of(2, 4, 6, 8), v.plus(v));
    }
}
