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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of a single solve call. For satisfiable formulas, a witness is available: the boolean
 * model of the atoms, the corresponding theory literals and the partition of all terms.
 */
public final class SolverResult {
    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        /** Neither verdict could be established, e.g. due to a timeout or an oracle failure. */
        UNKNOWN
    }

    private final Status status;
    private final int iterations;
    private final int blockingClauses;
    @Nullable
    private final ImmutableMap<Equation, Boolean> model;
    @Nullable
    private final ImmutableList<Literal> literals;
    @Nullable
    private final ImmutableSet<ImmutableSet<Term>> partition;
    @Nullable
    private final String reason;
    @Nullable
    private final Throwable cause;

    @SuppressWarnings("ParameterNumber")
    private SolverResult(
            Status status,
            int iterations,
            int blockingClauses,
            @Nullable ImmutableMap<Equation, Boolean> model,
            @Nullable ImmutableList<Literal> literals,
            @Nullable ImmutableSet<ImmutableSet<Term>> partition,
            @Nullable String reason,
            @Nullable Throwable cause) {
        this.status = status;
        this.iterations = iterations;
        this.blockingClauses = blockingClauses;
        this.model = model;
        this.literals = literals;
        this.partition = partition;
        this.reason = reason;
        this.cause = cause;
    }

    static SolverResult satisfiable(
            int iterations,
            int blockingClauses,
            ImmutableMap<Equation, Boolean> model,
            ImmutableList<Literal> literals,
            ImmutableSet<ImmutableSet<Term>> partition) {
        return new SolverResult(
                Status.SATISFIABLE, iterations, blockingClauses, model, literals, partition, null, null);
    }

    static SolverResult unsatisfiable(int iterations, int blockingClauses) {
        return new SolverResult(Status.UNSATISFIABLE, iterations, blockingClauses, null, null, null, null, null);
    }

    static SolverResult unknown(int iterations, int blockingClauses, String reason, @Nullable Throwable cause) {
        return new SolverResult(Status.UNKNOWN, iterations, blockingClauses, null, null, null, reason, cause);
    }

    public Status status() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return status == Status.UNSATISFIABLE;
    }

    public boolean isUnknown() {
        return status == Status.UNKNOWN;
    }

    /**
     * Number of theory checks performed.
     */
    public int iterations() {
        return iterations;
    }

    public int blockingClauses() {
        return blockingClauses;
    }

    /**
     * Truth value of each atom in the satisfying boolean model.
     */
    public Optional<ImmutableMap<Equation, Boolean>> model() {
        return Optional.ofNullable(model);
    }

    /**
     * The theory literals of the satisfying model.
     */
    public Optional<ImmutableList<Literal>> literals() {
        return Optional.ofNullable(literals);
    }

    /**
     * Equivalence classes of all terms under the satisfying model.
     */
    public Optional<ImmutableSet<ImmutableSet<Term>>> partition() {
        return Optional.ofNullable(partition);
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        switch (status) {
            case SATISFIABLE:
                return String.format("sat after %d iterations %s", iterations, partition);
            case UNSATISFIABLE:
                return String.format("unsat after %d iterations", iterations);
            case UNKNOWN:
                return String.format("unknown after %d iterations (%s)", iterations, reason);
            default:
                throw new AssertionError(status);
        }
    }
}
