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

import java.util.BitSet;
import java.util.Optional;

/**
 * Boolean satisfiability engine used by the {@link LazySolver}. Each solve call opens its own
 * {@link Session}, which is queried repeatedly while clauses are added.
 */
public interface SatOracle {
    /**
     * Opens a session over the propositions {@code 0, ..., propositions - 1}.
     */
    Session open(int propositions) throws OracleUnavailableException;

    interface Session extends AutoCloseable {
        /**
         * Conjoins the given formula to the constraints of this session.
         */
        void assertFormula(BooleanFormula formula) throws OracleUnavailableException;

        /**
         * Conjoins the disjunction of the given literals to the constraints of this session.
         * Literals follow the DIMACS convention: {@code p + 1} denotes proposition {@code p},
         * {@code -(p + 1)} its negation. An empty clause is unsatisfiable.
         */
        void addClause(int... literals) throws OracleUnavailableException;

        /**
         * Searches a satisfying assignment of all constraints added so far.
         *
         * @return The assignment, where bit {@code p} is set iff proposition {@code p} is true, or
         *     empty if the constraints are unsatisfiable.
         * @throws OracleUnavailableException if no definitive answer can be given.
         */
        Optional<BitSet> solve() throws OracleUnavailableException;

        /**
         * Returns a human-readable summary of the session, format may change.
         */
        default String statistics() {
            return "";
        }

        @Override
        default void close() {
            // empty
        }
    }
}
