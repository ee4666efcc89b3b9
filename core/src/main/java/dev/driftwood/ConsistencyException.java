/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood;

/**
 * Thrown when indexed data contradicts an invariant the index relies on, such as
 * differing column names across group members or timestamps that are not ordered.
 */
public class ConsistencyException extends RuntimeException {

    public ConsistencyException(String message) {
        super(message);
    }
}
