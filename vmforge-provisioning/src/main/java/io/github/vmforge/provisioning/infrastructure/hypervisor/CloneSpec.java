package io.github.vmforge.provisioning.infrastructure.hypervisor;

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

import io.github.vmforge.provisioning.VmForgeStyle;
import io.github.vmforge.provisioning.application.hypervisor.InventoryObject;
import org.immutables.value.Value;

/**
 * Parameters of cloning a template into a new VM, with all inventory objects already resolved.
 */
@Value.Immutable
@VmForgeStyle
public interface CloneSpec {
    InventoryObject getTemplate();

    String getName();

    InventoryObject getFolder();

    InventoryObject getResourcePool();

    InventoryObject getDatastore();

    InventoryObject getNetwork();

    int getCpuCores();

    int getMemoryMb();

    @Value.Default
    default boolean isPowerOn() {
        return true;
    }

    class Builder extends ImmutableCloneSpec.Builder {

    }
}
