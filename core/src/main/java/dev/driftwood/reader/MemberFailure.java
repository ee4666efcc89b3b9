/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.nio.file.Path;

/**
 * A member file that was left out of a {@link FileGroup} under {@link MemberFailurePolicy#CONTINUE}.
 *
 * @param path the data file
 * @param cause why it could not be opened or indexed
 */
public record MemberFailure(Path path, Exception cause) {
}
