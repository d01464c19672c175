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

public final class Solvers {
    private Solvers() {}

    public static LazySolver create() {
        return create(ImmutableSolverConfiguration.builder().build());
    }

    public static LazySolver create(SolverConfiguration configuration) {
        return create(configuration, new BddSatOracle(configuration));
    }

    public static LazySolver create(SolverConfiguration configuration, SatOracle oracle) {
        return new LazySolver(configuration, oracle);
    }

    /**
     * Creates a solver using recursive congruence propagation, whose call depth grows with the
     * term depth.
     */
    public static LazySolver createRecursive() {
        return create(ImmutableSolverConfiguration.builder().iterative(false).build());
    }
}
