/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a data file, offset cache or descriptor cannot be opened.
 */
public class ConfigurationException extends IOException {

    private final Path path;

    public ConfigurationException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public ConfigurationException(String message, Path path) {
        this(message, path, null);
    }

    /**
     * The file that could not be opened.
     */
    public Path getPath() {
        return path;
    }
}
