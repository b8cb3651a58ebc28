package io.github.vmforge.es.store;

/*-
 * #%L
 * vmforge-es
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
 * Local subscriber notified after events were durably appended. Delivery is at-least-once, so implementations need
 * to be idempotent. Exceptions thrown by a listener are logged by the publisher and otherwise ignored.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(StoredEvent event) throws Exception;
}
