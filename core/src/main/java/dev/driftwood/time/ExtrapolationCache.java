/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.time;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Linear fits used outside the covered time range, computed on first use per column and side.
 */
final class ExtrapolationCache {

    enum Side {
        BELOW_RANGE,
        ABOVE_RANGE
    }

    @FunctionalInterface
    interface Loader {
        LinearFit fit(String column, Side side) throws IOException;
    }

    private record Key(String column, Side side) {
    }

    private final Map<Key, LinearFit> fits = new HashMap<>();
    private final Loader loader;

    ExtrapolationCache(Loader loader) {
        this.loader = loader;
    }

    LinearFit get(String column, Side side) throws IOException {
        Key key = new Key(column, side);
        LinearFit fit = fits.get(key);
        if (fit == null) {
            fit = loader.fit(column, side);
            fits.put(key, fit);
        }
        return fit;
    }

    void clear() {
        fits.clear();
    }

    int size() {
        return fits.size();
    }
}
