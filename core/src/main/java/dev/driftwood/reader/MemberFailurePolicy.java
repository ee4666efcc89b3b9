/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.util.Locale;

/**
 * What a {@link FileGroup} does when one of its member files cannot be opened or indexed.
 */
public enum MemberFailurePolicy {

    /**
     * The failure is propagated and the group update is aborted.
     */
    FAIL_FAST,

    /**
     * The member is left out of the group, the failure is logged and recorded in
     * {@link FileGroup#failures()}.
     */
    CONTINUE;

    public static final String SYSTEM_PROPERTY = "driftwood.group.failurePolicy";

    /**
     * Reads the policy from the {@value #SYSTEM_PROPERTY} system property, defaulting to {@link #FAIL_FAST}.
     */
    public static MemberFailurePolicy fromSystemProperty() {
        String value = System.getProperty(SYSTEM_PROPERTY);
        if (value == null || value.isBlank()) {
            return FAIL_FAST;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown member failure policy '" + value + "' in system property "
                    + SYSTEM_PROPERTY + ", expected one of FAIL_FAST, CONTINUE", e);
        }
    }
}
