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

import static de.tum.in.jeuf.Generator.a;
import static de.tum.in.jeuf.Generator.b;
import static de.tum.in.jeuf.Generator.c;
import static de.tum.in.jeuf.Generator.f;
import static de.tum.in.jeuf.Generator.fChain;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@SuppressWarnings("checkstyle:javadoc")
public class LazySolverTest {
    private static final Logger logger = Logger.getLogger(LazySolverTest.class.getName());

    private static final Formula scenario4 = Formula.or(Formula.equal(a, b), Formula.equal(b, c));
    private static final Formula scenario5 = Formula.and(scenario4, Formula.distinct(a, c));
    private static final Formula scenario6 =
            Formula.and(Formula.equal(a, b), Formula.equal(b, c), Formula.distinct(a, c));

    private static Stream<SolverConfiguration> configurations() {
        List<SolverConfiguration> configurations = new ArrayList<>();
        for (BlockingStrategy strategy : BlockingStrategy.values()) {
            for (boolean iterative : new boolean[] {false, true}) {
                configurations.add(ImmutableSolverConfiguration.builder()
                        .blockingStrategy(strategy)
                        .iterative(iterative)
                        .integrityChecks(true)
                        .build());
            }
        }
        return configurations.stream();
    }

    private static void checkWitness(Formula formula, SolverResult result) {
        assertThat(result.isSatisfiable(), is(true));
        ImmutableMap<Equation, Boolean> model = result.model().orElseThrow();
        assertThat(formula.evaluate(atom -> model.get(atom.oriented())), is(true));

        ImmutableList<Literal> literals = result.literals().orElseThrow();
        assertThat(literals.size(), is(model.size()));
        assertThat(Generator.naiveSatisfiable(literals), is(true));

        ImmutableSet<ImmutableSet<Term>> partition = result.partition().orElseThrow();
        for (Literal literal : literals) {
            boolean together = false;
            for (ImmutableSet<Term> block : partition) {
                if (block.contains(literal.equation().lhs())) {
                    together = block.contains(literal.equation().rhs());
                }
            }
            assertThat(literal.toString(), together, is(literal.isPositive()));
        }
    }

    @ParameterizedTest
    @MethodSource("configurations")
    public void testLiteralScenarios(SolverConfiguration configuration) {
        LazySolver solver = Solvers.create(configuration);
        assertThat(solver.isSatisfiable(List.of(Literal.equal(a, b))), is(true));
        assertThat(solver.isSatisfiable(List.of(Literal.equal(a, b), Literal.distinct(a, b))), is(false));
        assertThat(solver.isSatisfiable(List.of(Literal.equal(a, b), Literal.distinct(f(a), f(b)))), is(false));
        assertThat(solver.check(List.of(Literal.equal(a, b))).partition().size(), is(1));
    }

    @ParameterizedTest
    @MethodSource("configurations")
    public void testFormulaScenarios(SolverConfiguration configuration) throws InvalidFormatException {
        LazySolver solver = Solvers.create(configuration);

        SolverResult result4 = solver.solve(scenario4);
        checkWitness(scenario4, result4);
        assertThat(result4.iterations(), is(1));

        SolverResult result5 = solver.solve(scenario5);
        checkWitness(scenario5, result5);
        Set<Equation> trueAtoms = new HashSet<>();
        result5.model().orElseThrow().forEach((atom, value) -> {
            if (value) {
                trueAtoms.add(atom);
            }
        });
        assertThat(trueAtoms.size(), is(1));

        SolverResult result6 = solver.solve(scenario6);
        assertThat(result6.status(), is(SolverResult.Status.UNSATISFIABLE));
        assertThat(result6.iterations(), is(1));
        assertThat(result6.blockingClauses(), is(1));
        assertThat(result6.model().isPresent(), is(false));
    }

    @ParameterizedTest
    @MethodSource("configurations")
    public void testEquationsInBothOrientations(SolverConfiguration configuration) throws InvalidFormatException {
        LazySolver solver = Solvers.create(configuration);
        assertThat(solver.solve(Formula.and(Formula.equal(a, b), Formula.distinct(b, a))).isUnsatisfiable(), is(true));
        assertThat(solver.solve(Formula.xor(Formula.equal(a, b), Formula.equal(b, a))).isUnsatisfiable(), is(true));
        assertThat(solver.solve(Formula.distinct(a, a)).isUnsatisfiable(), is(true));
        assertThat(solver.solve(Formula.constant(true)).isSatisfiable(), is(true));
        assertThat(solver.solve(Formula.constant(false)).isUnsatisfiable(), is(true));
    }

    @ParameterizedTest
    @MethodSource("configurations")
    public void testAgreesWithEnumeration(SolverConfiguration configuration) throws InvalidFormatException {
        LazySolver solver = Solvers.create(configuration);
        Random random = new Random(11L);
        int satisfiable = 0;
        int unsatisfiable = 0;
        for (int round = 0; round < 150; round++) {
            List<Equation> atoms = new ArrayList<>();
            int atomCount = 2 + random.nextInt(5);
            for (int i = 0; i < atomCount; i++) {
                atoms.add(Generator.randomEquation(random, 1));
            }
            Formula formula = Generator.randomFormula(random, atoms, 1 + random.nextInt(3));

            boolean expected = Generator.naiveSatisfiable(formula);
            SolverResult result = solver.solve(formula);
            assertThat(formula.toString(), result.isSatisfiable(), is(expected));
            assertThat(result.isUnknown(), is(false));
            if (expected) {
                checkWitness(formula, result);
                satisfiable += 1;
            } else {
                unsatisfiable += 1;
            }
        }
        logger.log(Level.INFO, "{0}: {1} satisfiable, {2} unsatisfiable", new Object[] {
            configuration.blockingStrategy(), satisfiable, unsatisfiable
        });
        assertThat(satisfiable > 0, is(true));
    }

    @ParameterizedTest
    @MethodSource("configurations")
    public void testModelsDistinct(SolverConfiguration configuration) throws InvalidFormatException {
        Random random = new Random(13L);
        for (int round = 0; round < 50; round++) {
            RecordingOracle oracle = new RecordingOracle(new BddSatOracle());
            LazySolver solver = Solvers.create(configuration, oracle);

            List<Equation> atoms = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                atoms.add(Generator.randomEquation(random, 1));
            }
            Formula formula = Generator.randomFormula(random, atoms, 3);
            SolverResult result = solver.solve(formula);

            int propositions = BooleanAbstraction.of(formula).propositionCount();
            assertThat(result.iterations(), lessThanOrEqualTo(1 << propositions));
            assertThat(new HashSet<>(oracle.models).size(), is(oracle.models.size()));
            assertThat(oracle.models.size(), is(result.iterations()));
        }
    }

    @Test
    public void testMinimalBlockingNeedsFewerIterations() throws InvalidFormatException {
        // Only the chain a = x1 = ... = c matters, the other atoms are irrelevant for the conflict
        List<Formula> operands = new ArrayList<>();
        Term previous = a;
        for (int i = 1; i <= 3; i++) {
            Term next = Term.variable("x" + i);
            operands.add(Formula.equal(previous, next));
            previous = next;
        }
        operands.add(Formula.equal(previous, c));
        operands.add(Formula.distinct(a, c));
        for (int i = 0; i < 4; i++) {
            operands.add(Formula.or(Formula.equal(b, Term.variable("y" + i)), Formula.equal(c, Term.variable("y" + i))));
        }
        Formula formula = Formula.and(operands);

        SolverResult model = Solvers.create(ImmutableSolverConfiguration.builder()
                        .blockingStrategy(BlockingStrategy.MODEL)
                        .build())
                .solve(formula);
        SolverResult minimal = Solvers.create(ImmutableSolverConfiguration.builder()
                        .blockingStrategy(BlockingStrategy.MINIMAL)
                        .build())
                .solve(formula);
        assertThat(model.isUnsatisfiable(), is(true));
        assertThat(minimal.isUnsatisfiable(), is(true));
        assertThat(minimal.iterations(), is(1));
        assertThat(model.iterations() > minimal.iterations(), is(true));
    }

    @Test
    public void testInvalidSignature() {
        LazySolver solver = Solvers.create();
        assertThrows(InvalidFormatException.class,
                () -> solver.solve(Formula.or(Formula.equal(f(a), b), Formula.equal(Term.apply("f", a, b), c))));
    }

    @Test
    public void testOracleFailureIsUnknown() throws InvalidFormatException {
        OracleUnavailableException failure = new OracleUnavailableException("out of resources");
        SatOracle failing = propositions -> new SatOracle.Session() {
            @Override
            public void assertFormula(BooleanFormula formula) {
                // accepted
            }

            @Override
            public void addClause(int... literals) {
                // accepted
            }

            @Override
            public Optional<BitSet> solve() throws OracleUnavailableException {
                throw failure;
            }
        };
        SolverResult result = Solvers.create(ImmutableSolverConfiguration.builder().build(), failing)
                .solve(scenario6);
        assertThat(result.status(), is(SolverResult.Status.UNKNOWN));
        assertThat(result.cause().orElseThrow(), is(failure));
        assertThat(result.reason().isPresent(), is(true));
    }

    @Test
    public void testNodeLimitIsUnknown() throws InvalidFormatException {
        SolverConfiguration configuration = ImmutableSolverConfiguration.builder()
                .oracleInitialSize(16)
                .oracleMaximumNodes(16)
                .build();
        List<Formula> operands = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            operands.add(Formula.equal(Term.variable("u" + i), Term.variable("v" + i)));
        }
        SolverResult result = Solvers.create(configuration).solve(Formula.and(operands));
        assertThat(result.isUnknown(), is(true));
        assertThat(result.cause().orElseThrow(), instanceOf(OracleUnavailableException.class));
    }

    @Test
    public void testTimeoutIsUnknown() throws InvalidFormatException {
        SatOracle slow = new SlowOracle(new BddSatOracle(), 50L);
        SolverConfiguration configuration = ImmutableSolverConfiguration.builder()
                .timeoutMillis(1L)
                .build();
        SolverResult result = Solvers.create(configuration, slow).solve(scenario6);
        assertThat(result.isUnknown(), is(true));
        assertThat(result.reason().orElseThrow(), is("timeout"));
        assertThat(result.iterations(), lessThanOrEqualTo(1));
    }

    @Test
    public void testInterruptIsUnknown() throws InvalidFormatException {
        LazySolver solver = Solvers.create();
        Thread.currentThread().interrupt();
        SolverResult result;
        try {
            result = solver.solve(scenario4);
        } finally {
            // Clear the flag for subsequent tests
            Thread.interrupted();
        }
        assertThat(result.isUnknown(), is(true));
        assertThat(result.reason().orElseThrow(), is("interrupted"));
        assertThat(result.iterations(), is(0));
    }

    @Test
    public void testStatisticsLogging() throws InvalidFormatException {
        LazySolver solver = Solvers.create(ImmutableSolverConfiguration.builder()
                .logStatistics(true)
                .integrityChecks(true)
                .build());
        assertThat(solver.solve(scenario5).isSatisfiable(), is(true));
        assertThat(solver.configuration().logStatistics(), is(true));
        assertThat(Solvers.create().configuration().iterative(), is(true));
        assertThat(Solvers.createRecursive().configuration().iterative(), is(false));
    }

    @Test
    public void testParallelSolves() throws InterruptedException, ExecutionException, InvalidFormatException {
        LazySolver solver = Solvers.create();
        Random random = new Random(17L);
        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            List<Equation> atoms = new ArrayList<>();
            for (int j = 0; j < 5; j++) {
                atoms.add(Generator.randomEquation(random, 2));
            }
            formulas.add(Generator.randomFormula(random, atoms, 3));
        }
        List<SolverResult.Status> sequential = new ArrayList<>();
        for (Formula formula : formulas) {
            sequential.add(solver.solve(formula).status());
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<SolverResult>> futures = new ArrayList<>();
            for (Formula formula : formulas) {
                futures.add(executor.submit(() -> solver.solve(formula)));
            }
            for (int i = 0; i < formulas.size(); i++) {
                assertThat(futures.get(i).get().status(), is(sequential.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class RecordingOracle implements SatOracle {
        private final SatOracle delegate;
        final List<BitSet> models = new ArrayList<>();

        RecordingOracle(SatOracle delegate) {
            this.delegate = delegate;
        }

        @Override
        public Session open(int propositions) throws OracleUnavailableException {
            Session session = delegate.open(propositions);
            return new Session() {
                @Override
                public void assertFormula(BooleanFormula formula) throws OracleUnavailableException {
                    session.assertFormula(formula);
                }

                @Override
                public void addClause(int... literals) throws OracleUnavailableException {
                    session.addClause(literals);
                }

                @Override
                public Optional<BitSet> solve() throws OracleUnavailableException {
                    Optional<BitSet> model = session.solve();
                    model.ifPresent(assignment -> models.add((BitSet) assignment.clone()));
                    return model;
                }

                @Override
                public void close() {
                    session.close();
                }
            };
        }
    }

    private static final class SlowOracle implements SatOracle {
        private final SatOracle delegate;
        private final long delayMillis;

        SlowOracle(SatOracle delegate, long delayMillis) {
            this.delegate = delegate;
            this.delayMillis = delayMillis;
        }

        @Override
        public Session open(int propositions) throws OracleUnavailableException {
            Session session = delegate.open(propositions);
            return new Session() {
                @Override
                public void assertFormula(BooleanFormula formula) throws OracleUnavailableException {
                    session.assertFormula(formula);
                }

                @Override
                public void addClause(int... literals) throws OracleUnavailableException {
                    session.addClause(literals);
                }

                @Override
                public Optional<BitSet> solve() throws OracleUnavailableException {
                    try {
                        Thread.sleep(delayMillis);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new OracleUnavailableException("Interrupted while waiting", e);
                    }
                    return session.solve();
                }
            };
        }
    }

    @Test
    public void testDeepTermsWithDefaultConfiguration() throws InvalidFormatException {
        int depth = 50_000;
        Term left = fChain(a, depth);
        Term right = fChain(b, depth);
        LazySolver solver = Solvers.create();

        assertThat(solver.solve(Formula.and(Formula.equal(a, b), Formula.distinct(left, right))).isUnsatisfiable(),
                is(true));
        SolverResult result = solver.solve(Formula.or(Formula.equal(a, b), Formula.distinct(right, left)));
        assertThat(result.isSatisfiable(), is(true));
        int partitioned = 0;
        for (ImmutableSet<Term> block : result.partition().orElseThrow()) {
            partitioned += block.size();
        }
        assertThat(partitioned, is(2 * (depth + 1)));
    }
}
