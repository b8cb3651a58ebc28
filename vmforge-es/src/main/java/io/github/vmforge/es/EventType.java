package io.github.vmforge.es;

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
 * Naming conventions for event types.
 */
public class EventType {
    private EventType() {

    }

    public static String fromClassStripping(Class<?> clazz, String stripPrefix, String stripSuffix) {
        return fromSimpleClassnameStripping(clazz.getSimpleName(), stripPrefix, stripSuffix);
    }

    /**
     * Default type name of an event class. ImmutableOrderPlacedEvent and OrderPlacedEvent both become
     * OrderPlaced.
     * @param clazz the event class, abstract or generated
     * @return type name
     */
    public static String defaultTypeName(Class<?> clazz) {
        return fromClassStripping(clazz, "Immutable", "Event");
    }

    /**
     * Name of the class Immutables generates for an abstract value type with the default naming style.
     * @param abstractType abstract value type
     * @return fully qualified name of its implementation
     */
    public static String immutableImplementationName(Class<?> abstractType) {
        return abstractType.getPackage().getName() + ".Immutable" + abstractType.getSimpleName();
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        return simpleClassName.substring(start, end);
    }
}
