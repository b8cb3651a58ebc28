package io.github.vmforge.provisioning.domain.vmrequest;

/*-
 * #%L
 * vmforge-provisioning
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.vmforge.provisioning.domain.InvalidValueException;

/**
 * T-shirt sizes a VM can be requested in.
 */
public enum VmSize {
    S(2, 4, 50),
    M(4, 8, 100),
    L(8, 16, 200),
    XL(16, 32, 500);

    private final int cpuCores;
    private final int memoryGb;
    private final int diskGb;

    VmSize(int cpuCores, int memoryGb, int diskGb) {
        this.cpuCores = cpuCores;
        this.memoryGb = memoryGb;
        this.diskGb = diskGb;
    }

    public int getCpuCores() {
        return cpuCores;
    }

    public int getMemoryGb() {
        return memoryGb;
    }

    public int getMemoryMb() {
        return memoryGb * 1024;
    }

    public int getDiskGb() {
        return diskGb;
    }

    public static VmSize fromCode(String code) throws InvalidValueException {
        if (code != null) {
            for (VmSize size : values()) {
                if (size.name().equalsIgnoreCase(code.trim())) {
                    return size;
                }
            }
        }
        throw new InvalidValueException("size", "Unknown VM size " + code + ", expected one of S, M, L, XL");
    }
}
