package io.github.vmforge.provisioning.domain;

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
 * Reason given for a decision does not satisfy length constraints.
 */
public class InvalidReasonException extends DomainException {
    public static final int MIN_LENGTH = 10;
    public static final int MAX_LENGTH = 500;

    private final int length;

    public InvalidReasonException(int length) {
        super("Reason must be between " + MIN_LENGTH + " and " + MAX_LENGTH + " characters, was " + length);
        this.length = length;
    }

    public int getLength() {
        return length;
    }

    private InvalidReasonException(int length, String message) {
        super(message);
        this.length = length;
    }

    /**
     * Check a mandatory reason. The length is counted on the reason as given, surrounding whitespace included.
     * @param reason the reason
     * @throws InvalidReasonException when shorter than {@link #MIN_LENGTH} or longer than {@link #MAX_LENGTH}
     */
    public static void check(String reason) throws InvalidReasonException {
        int length = reason == null ? 0 : reason.length();
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new InvalidReasonException(length);
        }
    }

    public static void checkOptional(String reason) throws InvalidReasonException {
        if (reason != null && reason.length() > MAX_LENGTH) {
            throw new InvalidReasonException(reason.length(),
                "Reason must not exceed " + MAX_LENGTH + " characters, was " + reason.length());
        }
    }
}
