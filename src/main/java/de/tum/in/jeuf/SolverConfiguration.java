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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class SolverConfiguration {
    public static final int DEFAULT_ORACLE_INITIAL_SIZE = 1024;
    public static final double DEFAULT_ORACLE_GROWTH_FACTOR = 1.5d;
    public static final int DEFAULT_ORACLE_MAXIMUM_NODES = 1 << 24;

    /**
     * Whether congruence propagation uses an explicit work list instead of recursive merges. The
     * recursive variant needs call depth proportional to the term depth.
     */
    @Value.Default
    public boolean iterative() {
        return true;
    }

    @Value.Default
    public BlockingStrategy blockingStrategy() {
        return BlockingStrategy.CONFLICT;
    }

    /**
     * Time limit of a single solve call in milliseconds, non-positive values disable the limit.
     */
    @Value.Default
    public long timeoutMillis() {
        return 0L;
    }

    @Value.Default
    public boolean integrityChecks() {
        return false;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }

    @Value.Default
    public int oracleInitialSize() {
        return DEFAULT_ORACLE_INITIAL_SIZE;
    }

    @Value.Default
    public double oracleGrowthFactor() {
        return DEFAULT_ORACLE_GROWTH_FACTOR;
    }

    @Value.Default
    public int oracleMaximumNodes() {
        return DEFAULT_ORACLE_MAXIMUM_NODES;
    }

    @Value.Check
    protected void check() {
        if (oracleGrowthFactor() <= 1.0d) {
            throw new IllegalStateException("Growth factor must be bigger than 1, got " + oracleGrowthFactor());
        }
        if (oracleInitialSize() <= 0 || oracleMaximumNodes() <= 0) {
            throw new IllegalStateException("Oracle table sizes must be positive");
        }
    }
}
