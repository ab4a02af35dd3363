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

package com.netflix.ledgersched.plugins;

import com.netflix.ledgersched.AbstractSchedulingPolicy;
import com.netflix.ledgersched.SchedulingDecision;
import com.netflix.ledgersched.SchedulingPolicyType;
import com.netflix.ledgersched.TaskRequest;
import com.netflix.ledgersched.VirtualMachine;

import java.util.List;

/**
 * A policy that prefers idle VMs. The first admissible idle candidate wins with a score of 0. Otherwise the
 * admissible candidate with the lowest load score wins, the earliest one on equal load. The score is the load
 * score, lower is better.
 */
public class LeastLoadedPolicy extends AbstractSchedulingPolicy {

    public LeastLoadedPolicy() {
        super(SchedulingPolicyType.LEAST_LOADED);
    }

    @Override
    protected SchedulingDecision doSchedule(TaskRequest task, List<VirtualMachine> candidates) {
        for (VirtualMachine vm : candidates) {
            if (vm.canAdmit(task) && vm.loadScore() == 0.0)
                return new SchedulingDecision(vm, 0.0);
        }
        VirtualMachine best = null;
        double minLoad = Double.POSITIVE_INFINITY;
        for (VirtualMachine vm : candidates) {
            if (!vm.canAdmit(task))
                continue;
            double load = vm.loadScore();
            if (load < minLoad) {
                minLoad = load;
                best = vm;
            }
        }
        return best == null ? SchedulingDecision.rejected(Double.POSITIVE_INFINITY) : new SchedulingDecision(best, minLoad);
    }
}
