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
 * A policy that scores every admissible candidate by the task's deadline plus a load penalty and picks the lowest
 * score. Equal scores go to the lower VM id.
 */
public class UrgencyAwarePolicy extends AbstractSchedulingPolicy {

    static final double LOAD_PENALTY = 5.0;

    public UrgencyAwarePolicy() {
        super(SchedulingPolicyType.URGENCY_AWARE);
    }

    /**
     * Score a candidate: the deadline in seconds since the epoch plus five times the VM's load score.
     * Lower is better.
     *
     * @param task the task
     * @param vm   the candidate
     * @return the score
     */
    static double score(TaskRequest task, VirtualMachine vm) {
        return task.getDeadline() / 1000.0 + LOAD_PENALTY * vm.loadScore();
    }

    @Override
    protected SchedulingDecision doSchedule(TaskRequest task, List<VirtualMachine> candidates) {
        VirtualMachine best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        for (VirtualMachine vm : candidates) {
            if (!vm.canAdmit(task))
                continue;
            double score = score(task, vm);
            if (best == null || score < bestScore || (score == bestScore && vm.getId() < best.getId())) {
                best = vm;
                bestScore = score;
            }
        }
        return best == null ? SchedulingDecision.rejected(Double.POSITIVE_INFINITY) : new SchedulingDecision(best, bestScore);
    }
}
