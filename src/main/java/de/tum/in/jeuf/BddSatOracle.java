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
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link SatOracle} representing the constraints of a session as a single binary decision
 * diagram. Each proposition is a BDD variable, ordered by proposition number. Solving amounts to
 * picking a path to the {@code true} leaf.
 */
public final class BddSatOracle implements SatOracle {
    private static final Logger logger = Logger.getLogger(BddSatOracle.class.getName());

    private final int initialSize;
    private final double growthFactor;
    private final int maximumNodes;

    public BddSatOracle() {
        this(ImmutableSolverConfiguration.builder().build());
    }

    public BddSatOracle(SolverConfiguration configuration) {
        this.initialSize = configuration.oracleInitialSize();
        this.growthFactor = configuration.oracleGrowthFactor();
        this.maximumNodes = configuration.oracleMaximumNodes();
    }

    @Override
    public Session open(int propositions) throws OracleUnavailableException {
        if (propositions < 0) {
            throw new IllegalArgumentException("Negative number of propositions " + propositions);
        }
        BddTable table = new BddTable(Math.min(initialSize, maximumNodes), growthFactor, maximumNodes);
        try {
            for (int i = 0; i < propositions; i++) {
                table.createVariable();
            }
        } catch (BddTable.NodeLimitExceededException e) {
            throw new OracleUnavailableException("Could not create " + propositions + " variables", e);
        }
        return new BddSession(table);
    }

    @Override
    public String toString() {
        return String.format("BddSatOracle(%d, %.2f, %d)", initialSize, growthFactor, maximumNodes);
    }

    private static final class BddSession implements Session {
        private final BddTable table;
        private int constraint = BddTable.TRUE_NODE;
        private int clauses = 0;
        private int queries = 0;

        BddSession(BddTable table) {
            this.table = table;
        }

        @Override
        public void assertFormula(BooleanFormula formula) throws OracleUnavailableException {
            try {
                constraint = table.and(constraint, build(formula));
            } catch (BddTable.NodeLimitExceededException e) {
                throw new OracleUnavailableException("Formula too large for the node table", e);
            }
        }

        private int build(BooleanFormula formula) {
            if (formula instanceof BooleanFormula.Constant) {
                return ((BooleanFormula.Constant) formula).value() ? BddTable.TRUE_NODE : BddTable.FALSE_NODE;
            }
            if (formula instanceof BooleanFormula.Proposition) {
                return table.variableNode(((BooleanFormula.Proposition) formula).proposition());
            }
            if (formula instanceof BooleanFormula.Not) {
                return table.not(build(((BooleanFormula.Not) formula).operand()));
            }
            if (formula instanceof BooleanFormula.Operation) {
                BooleanFormula.Operation operation = (BooleanFormula.Operation) formula;
                List<BooleanFormula> operands = operation.operands();
                switch (operation.type()) {
                    case AND: {
                        int node = BddTable.TRUE_NODE;
                        for (BooleanFormula operand : operands) {
                            node = table.and(node, build(operand));
                            if (node == BddTable.FALSE_NODE) {
                                break;
                            }
                        }
                        return node;
                    }
                    case OR: {
                        int node = BddTable.FALSE_NODE;
                        for (BooleanFormula operand : operands) {
                            node = table.or(node, build(operand));
                            if (node == BddTable.TRUE_NODE) {
                                break;
                            }
                        }
                        return node;
                    }
                    case IMPLICATION:
                        return table.implication(build(operands.get(0)), build(operands.get(1)));
                    case EQUIVALENCE:
                        return table.equivalence(build(operands.get(0)), build(operands.get(1)));
                    case XOR:
                        return table.xor(build(operands.get(0)), build(operands.get(1)));
                    default:
                        throw new AssertionError(operation.type());
                }
            }
            throw new IllegalArgumentException("Unknown type " + formula.getClass().getSimpleName());
        }

        @Override
        public void addClause(int... literals) throws OracleUnavailableException {
            try {
                int clause = BddTable.FALSE_NODE;
                for (int literal : literals) {
                    if (literal == 0) {
                        throw new IllegalArgumentException("0 is not a literal");
                    }
                    int variable = table.variableNode(Math.abs(literal) - 1);
                    clause = table.or(clause, literal < 0 ? table.not(variable) : variable);
                }
                constraint = table.and(constraint, clause);
                clauses += 1;
            } catch (BddTable.NodeLimitExceededException e) {
                throw new OracleUnavailableException("Clause too large for the node table", e);
            }
        }

        @Override
        public Optional<BitSet> solve() {
            queries += 1;
            if (constraint == BddTable.FALSE_NODE) {
                return Optional.empty();
            }
            BitSet assignment = table.getSatisfyingAssignment(constraint);
            assert table.evaluate(constraint, assignment);
            if (logger.isLoggable(Level.FINEST)) {
                logger.log(Level.FINEST, "Query {0} of {1}: {2}", new Object[] {queries, table, assignment});
            }
            return Optional.of(assignment);
        }

        @Override
        public String statistics() {
            return String.format("Oracle: %d clauses, %d queries%n%s", clauses, queries, table.statistics());
        }
    }
}
