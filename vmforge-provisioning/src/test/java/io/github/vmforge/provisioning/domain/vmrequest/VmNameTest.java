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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class VmNameTest {

    @Test
    public void valid_names_are_trimmed() throws InvalidValueException {
        assertEquals("web-01", VmName.of("  web-01 ").getValue());
        assertEquals("abc", VmName.of("abc").getValue());
        assertEquals(63, VmName.of(repeat('a', 63)).getValue().length());
    }

    @Test
    public void invalid_names_are_rejected() {
        String[] invalid = { null, "ab", repeat('a', 64), "Web-01", "-web", "web-", "web--01", "web_01", "web 01" };
        for (String name : invalid) {
            try {
                VmName.of(name);
                fail("Name '" + name + "' should be rejected");
            } catch (InvalidValueException e) {
                assertEquals("vmName", e.getField());
            }
        }
    }

    @Test
    public void size_codes_are_case_insensitive() throws InvalidValueException {
        assertEquals(VmSize.XL, VmSize.fromCode(" xl "));
        assertEquals(8192, VmSize.fromCode("m").getMemoryMb());
        try {
            VmSize.fromCode("XXL");
            fail("Unknown size should be rejected");
        } catch (InvalidValueException e) {
            assertEquals("size", e.getField());
        }
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
