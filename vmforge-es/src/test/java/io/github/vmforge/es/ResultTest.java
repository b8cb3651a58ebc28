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

import org.junit.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ResultTest {

    @Test
    public void fold_picks_branch() {
        Result<Integer, String> ok = Result.success(2);
        Result<Integer, String> ko = Result.failure("broken");
        assertEquals("4", ok.map(v -> v * 2).fold(String::valueOf, e -> e));
        assertEquals("broken!", ko.map(v -> v * 2).mapError(e -> e + "!").fold(String::valueOf, e -> e));
    }

    @Test
    public void callbacks_only_for_matching_side() {
        AtomicReference<String> seen = new AtomicReference<>("none");
        Result.<Integer, String>failure("error").onSuccess(v -> seen.set("success")).onFailure(seen::set);
        assertEquals("error", seen.get());
    }

    @Test
    public void accessing_wrong_side_fails() {
        try {
            Result.success(1).getError();
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("no error"));
        }
    }
}
