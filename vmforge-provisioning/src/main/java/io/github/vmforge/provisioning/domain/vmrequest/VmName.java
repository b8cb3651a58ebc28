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

import java.util.regex.Pattern;

/**
 * Name of a VM as requested by the user. Usable as DNS label: 3 to 63 lowercase alphanumerics and hyphens, starting
 * and ending with alphanumeric, no consecutive hyphens.
 */
public final class VmName {
    static final int MIN_LENGTH = 3;
    static final int MAX_LENGTH = 63;
    private static final Pattern PATTERN = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?$");

    private final String value;

    private VmName(String value) {
        this.value = value;
    }

    public static VmName of(String raw) throws InvalidValueException {
        if (raw == null) {
            throw new InvalidValueException("vmName", "VM name is required");
        }
        String value = raw.trim();
        if (value.length() < MIN_LENGTH || value.length() > MAX_LENGTH) {
            throw new InvalidValueException("vmName", "VM name must be between " + MIN_LENGTH + " and " + MAX_LENGTH
                    + " characters");
        }
        if (!PATTERN.matcher(value).matches()) {
            throw new InvalidValueException("vmName",
                "VM name must consist of lowercase letters, digits and hyphens, starting and ending with letter or digit");
        }
        if (value.contains("--")) {
            throw new InvalidValueException("vmName", "VM name cannot contain consecutive hyphens");
        }
        return new VmName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VmName && value.equals(((VmName) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
