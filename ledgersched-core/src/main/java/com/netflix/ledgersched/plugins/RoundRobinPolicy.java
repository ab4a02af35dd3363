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
 * A policy that rotates through the candidates, picking the first one at or after its cursor that can admit the
 * task. The cursor starts over at the first candidate whenever the number of candidates changes. When no
 * candidate can admit the task the cursor is left where it was.
 * <p>
 * The score of a selection is the selected VM's load score; the score is 0 when nothing was selected.
 */
public class RoundRobinPolicy extends AbstractSchedulingPolicy {

    private int cursor = 0;
    private int lastCandidateCount = 0;

    public RoundRobinPolicy() {
        super(SchedulingPolicyType.ROUND_ROBIN);
    }

    @Override
    protected SchedulingDecision doSchedule(TaskRequest task, List<VirtualMachine> candidates) {
        final int n = candidates.size();
        if (n == 0)
            return SchedulingDecision.rejected(0.0);
        if (n != lastCandidateCount) {
            lastCandidateCount = n;
            cursor = 0;
        }
        final int start = cursor;
        for (int i = 0; i < n; i++) {
            VirtualMachine vm = candidates.get(cursor);
            cursor = (cursor + 1) % n;
            if (vm.canAdmit(task))
                return new SchedulingDecision(vm, vm.loadScore());
        }
        cursor = start;
        return SchedulingDecision.rejected(0.0);
    }

    /**
     * Get the index of the candidate the next scan starts at.
     *
     * @return the cursor
     */
    public int getCursor() {
        return underMonitor(() -> cursor);
    }
}
