/*
 * This file is part of JEUF.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JEUF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JEUF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JEUF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jeuf;

import java.util.Arrays;

final class Util {
    private Util() {}

    public static void checkState(boolean state, String formatString, Object... format) {
        if (!state) {
            throw new IllegalStateException(String.format(formatString, format));
        }
    }

    /**
     * Returns an array of at least {@code minimumSize}, growing by {@code growthFactor}.
     */
    public static int[] ensureCapacity(int[] array, int minimumSize, double growthFactor) {
        if (minimumSize <= array.length) {
            return array;
        }
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int grown = (int) Math.ceil(array.length * growthFactor);
        return Arrays.copyOf(array, Math.max(minimumSize, grown));
    }
}
