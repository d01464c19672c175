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

import static de.tum.in.jeuf.Util.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides boolean combinations of equality literals by lazily combining a {@link SatOracle} with
 * the {@link CongruenceClosure} procedure (DPLL(T) without theory propagation).
 *
 * <p>The atoms of the formula are abstracted into propositions. The oracle proposes a model of the
 * abstraction, which is projected to a conjunction of theory literals and checked. Inconsistent
 * models are excluded by a blocking clause and the oracle is queried again. As every blocking
 * clause is falsified by the model it blocks, at most {@code 2^k} models are checked for
 * {@code k} atoms.</p>
 *
 * <p>Solvers hold no per-solve state: each call to {@link #solve(Formula)} uses its own
 * abstraction, oracle session and E-graphs, so a solver may be used by multiple threads
 * concurrently.</p>
 */
public final class LazySolver {
    private static final Logger logger = Logger.getLogger(LazySolver.class.getName());

    enum State {
        SEARCHING,
        THEORY_CHECKING,
        SAT,
        UNSAT,
        UNKNOWN
    }

    private final SolverConfiguration configuration;
    private final SatOracle oracle;
    private final CongruenceClosure theory;

    LazySolver(SolverConfiguration configuration, SatOracle oracle) {
        this.configuration = configuration;
        this.oracle = oracle;
        this.theory = new CongruenceClosure(configuration);
    }

    public SolverConfiguration configuration() {
        return configuration;
    }

    /**
     * Decides a conjunction of literals directly with the congruence closure procedure.
     */
    public boolean isSatisfiable(Collection<Literal> literals) {
        return theory.isSatisfiable(literals);
    }

    /**
     * Checks a conjunction of literals, yielding the closure as witness.
     */
    public TheoryResult check(Collection<Literal> literals) {
        return theory.check(literals);
    }

    /**
     * Decides the given formula.
     *
     * @return The verdict. {@link SolverResult.Status#UNKNOWN} is returned if the time limit is
     *     exceeded, the thread is interrupted or the oracle fails; it is never turned into a
     *     definitive answer.
     * @throws InvalidFormatException if the formula uses some symbol inconsistently.
     */
    public SolverResult solve(Formula formula) throws InvalidFormatException {
        formula.checkSignature();
        BooleanAbstraction abstraction = BooleanAbstraction.of(formula);
        logger.log(Level.FINE, "Solving formula with {0} atoms", abstraction.propositionCount());
        return new Search(abstraction).run();
    }

    /**
     * The state of one solve call.
     */
    private final class Search {
        private final BooleanAbstraction abstraction;
        private final boolean hasDeadline;
        private final long deadline;
        private final List<int[]> clauses = new ArrayList<>();
        private State state = State.SEARCHING;
        private int iterations = 0;

        Search(BooleanAbstraction abstraction) {
            this.abstraction = abstraction;
            long timeout = configuration.timeoutMillis();
            this.hasDeadline = timeout > 0L;
            this.deadline = hasDeadline ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout) : 0L;
        }

        SolverResult run() {
            SolverResult result;
            try (SatOracle.Session session = oracle.open(abstraction.propositionCount())) {
                session.assertFormula(abstraction.formula());
                result = loop(session);
                if (configuration.logStatistics()) {
                    logger.log(Level.INFO, "{0}: {1} iterations, {2} blocking clauses{3}{4}", new Object[] {
                        result.status(), iterations, clauses.size(), System.lineSeparator(), session.statistics()
                    });
                }
            } catch (OracleUnavailableException e) {
                logger.log(Level.WARNING, "Oracle failed after " + iterations + " iterations", e);
                state = State.UNKNOWN;
                result = SolverResult.unknown(iterations, clauses.size(), "oracle unavailable: " + e.getMessage(), e);
            }
            assert state == State.SAT || state == State.UNSAT || state == State.UNKNOWN;
            return result;
        }

        private SolverResult loop(SatOracle.Session session) throws OracleUnavailableException {
            BitSet assignment = null;
            while (true) {
                switch (state) {
                    case SEARCHING: {
                        if (Thread.currentThread().isInterrupted()) {
                            state = State.UNKNOWN;
                            return SolverResult.unknown(iterations, clauses.size(), "interrupted", null);
                        }
                        if (hasDeadline && System.nanoTime() - deadline >= 0L) {
                            state = State.UNKNOWN;
                            return SolverResult.unknown(iterations, clauses.size(), "timeout", null);
                        }
                        Optional<BitSet> model = session.solve();
                        if (model.isEmpty()) {
                            state = State.UNSAT;
                            logger.log(Level.FINE, "No further model after {0} iterations", iterations);
                            return SolverResult.unsatisfiable(iterations, clauses.size());
                        }
                        assignment = model.get();
                        if (configuration.integrityChecks()) {
                            checkModel(assignment);
                        }
                        state = State.THEORY_CHECKING;
                        break;
                    }
                    case THEORY_CHECKING: {
                        assert assignment != null;
                        iterations += 1;
                        ImmutableList<Literal> literals = abstraction.project(assignment);
                        TheoryResult result = theory.check(literals);
                        if (result.isConsistent()) {
                            state = State.SAT;
                            logger.log(Level.FINE, "Found consistent model after {0} iterations", iterations);
                            return SolverResult.satisfiable(
                                    iterations, clauses.size(), abstraction.model(assignment), literals, result.partition());
                        }
                        int[] clause = blockingClause(assignment, result);
                        clauses.add(clause);
                        if (logger.isLoggable(Level.FINER)) {
                            logger.log(Level.FINER, "Iteration {0}: violated {1}, blocking {2}", new Object[] {
                                iterations, result.violatedDisequality().orElseThrow(), Arrays.toString(clause)
                            });
                        }
                        session.addClause(clause);
                        state = State.SEARCHING;
                        break;
                    }
                    default:
                        throw new AssertionError(state);
                }
            }
        }

        private int[] blockingClause(BitSet assignment, TheoryResult result) {
            int count = abstraction.propositionCount();
            if (configuration.blockingStrategy() == BlockingStrategy.MODEL) {
                int[] clause = new int[count];
                for (int proposition = 0; proposition < count; proposition++) {
                    clause[proposition] = assignment.get(proposition) ? -(proposition + 1) : proposition + 1;
                }
                return clause;
            }

            Equation violated = result.violatedDisequality().orElseThrow();
            List<Equation> equalities = configuration.blockingStrategy() == BlockingStrategy.MINIMAL
                    ? theory.minimizeConflict(result.equalities(), violated)
                    : result.equalities();
            int[] clause = new int[equalities.size() + 1];
            for (int i = 0; i < equalities.size(); i++) {
                clause[i] = -(propositionOf(equalities.get(i)) + 1);
            }
            clause[equalities.size()] = propositionOf(violated) + 1;
            return clause;
        }

        private int propositionOf(Equation atom) {
            int proposition = abstraction.proposition(atom);
            checkState(proposition >= 0, "Atom %s has no proposition", atom);
            return proposition;
        }

        private void checkModel(BitSet assignment) {
            checkState(abstraction.formula().evaluate(assignment), "Oracle model %s violates the formula", assignment);
            for (int[] clause : clauses) {
                boolean satisfied = false;
                for (int literal : clause) {
                    if (assignment.get(Math.abs(literal) - 1) == (literal > 0)) {
                        satisfied = true;
                        break;
                    }
                }
                checkState(satisfied, "Oracle model %s violates blocking clause %s", assignment, Arrays.toString(clause));
            }
        }
    }
}
