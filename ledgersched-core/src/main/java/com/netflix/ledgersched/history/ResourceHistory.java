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

package com.netflix.ledgersched.history;

import com.netflix.ledgersched.VirtualMachine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps, per VM id, a window of the most recent utilization snapshots. When a window is full the oldest snapshot
 * is dropped to make room for the newest.
 * <p>
 * This class is not synchronized. Invocations of methods of this class must be synchronized externally if there is
 * a chance of calling them concurrently.
 */
public class ResourceHistory {
    private final int windowSize;
    private final Map<Integer, Deque<UtilizationSnapshot>> windows = new HashMap<>();

    public ResourceHistory(int windowSize) {
        if (windowSize < 1)
            throw new IllegalArgumentException("Window size must be >0: " + windowSize);
        this.windowSize = windowSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Append the VM's current utilization to its window.
     *
     * @param vm the VM
     * @return the snapshot recorded
     */
    public UtilizationSnapshot record(VirtualMachine vm) {
        UtilizationSnapshot snapshot = UtilizationSnapshot.of(vm);
        Deque<UtilizationSnapshot> window = windows.computeIfAbsent(vm.getId(), id -> new ArrayDeque<>(windowSize));
        if (window.size() == windowSize)
            window.removeFirst();
        window.addLast(snapshot);
        return snapshot;
    }

    /**
     * Get the historical resource usage of a VM: the mean of the snapshot means in its window.
     *
     * @param vmId the VM id
     * @return the historical usage, or 0.0 if nothing was recorded for the VM
     */
    public double historicalUsage(int vmId) {
        Deque<UtilizationSnapshot> window = windows.get(vmId);
        if (window == null || window.isEmpty())
            return 0.0;
        double total = 0.0;
        for (UtilizationSnapshot snapshot : window)
            total += snapshot.getMean();
        return total / window.size();
    }

    /**
     * Get the snapshots in a VM's window, oldest first.
     *
     * @param vmId the VM id
     * @return the snapshots, empty if nothing was recorded for the VM
     */
    public List<UtilizationSnapshot> getSnapshots(int vmId) {
        Deque<UtilizationSnapshot> window = windows.get(vmId);
        if (window == null)
            return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(window));
    }

    public int size(int vmId) {
        Deque<UtilizationSnapshot> window = windows.get(vmId);
        return window == null ? 0 : window.size();
    }
}
