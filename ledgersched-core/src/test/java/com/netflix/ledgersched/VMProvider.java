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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VMProvider {

    public static List<VirtualMachine> getVMs(final int count, final double cpus, final double memory,
                                              final double io, final double network) {
        List<VirtualMachine> vms = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
            vms.add(new VirtualMachine(i, ResourceVector.of(cpus, memory, io, network)));
        return vms;
    }

    public static VirtualMachine getVM(final int id, final ResourceVector capacity, final ResourceVector usage) {
        return new VirtualMachine(id, capacity, usage, Collections.<String>emptyList());
    }
}
