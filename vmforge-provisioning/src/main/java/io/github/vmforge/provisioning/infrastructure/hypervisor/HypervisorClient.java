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

/**
 * Entry point of a hypervisor binding.
 */
@FunctionalInterface
public interface HypervisorClient {
    /**
     * Open an authenticated connection. Blocking.
     * @param url endpoint of the hypervisor API
     * @param username user name
     * @param password plain text password
     * @return open connection
     * @throws HypervisorBindingException with {@link HypervisorBindingException.Fault#AUTHENTICATION} when
     *         credentials are rejected, {@link HypervisorBindingException.Fault#CONNECTION} when the endpoint cannot be
     *         reached
     */
    HypervisorConnection connect(String url, String username, String password) throws HypervisorBindingException;
}
