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
import de.tum.in.jeuf.Formula.OperationType;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Propositional formula over propositions numbered from 0, as handed to a {@link SatOracle}.
 */
public abstract class BooleanFormula {
    private static final BooleanFormula TRUE = new Constant(true);
    private static final BooleanFormula FALSE = new Constant(false);

    BooleanFormula() {}

    public static BooleanFormula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static BooleanFormula proposition(int proposition) {
        if (proposition < 0) {
            throw new IllegalArgumentException("Negative proposition " + proposition);
        }
        return new Proposition(proposition);
    }

    public static BooleanFormula not(BooleanFormula operand) {
        return new Not(operand);
    }

    public static BooleanFormula operation(OperationType type, List<BooleanFormula> operands) {
        if (type.isBinary() && operands.size() != 2) {
            throw new IllegalArgumentException(type + " requires two operands, got " + operands.size());
        }
        return new Operation(type, ImmutableList.copyOf(operands));
    }

    /**
     * Evaluates the formula, proposition {@code i} is true iff bit {@code i} is set.
     */
    public abstract boolean evaluate(BitSet assignment);

    abstract void collectSupport(BitSet support);

    /**
     * Returns the set of propositions occurring in this formula.
     */
    public BitSet support() {
        BitSet support = new BitSet();
        collectSupport(support);
        return support;
    }

    public static final class Constant extends BooleanFormula {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public boolean evaluate(BitSet assignment) {
            return value;
        }

        @Override
        void collectSupport(BitSet support) {
            // empty
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    public static final class Proposition extends BooleanFormula {
        private final int proposition;

        Proposition(int proposition) {
            this.proposition = proposition;
        }

        public int proposition() {
            return proposition;
        }

        @Override
        public boolean evaluate(BitSet assignment) {
            return assignment.get(proposition);
        }

        @Override
        void collectSupport(BitSet support) {
            support.set(proposition);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Proposition && proposition == ((Proposition) o).proposition);
        }

        @Override
        public int hashCode() {
            return proposition;
        }

        @Override
        public String toString() {
            return "p" + proposition;
        }
    }

    public static final class Not extends BooleanFormula {
        private final BooleanFormula operand;

        Not(BooleanFormula operand) {
            this.operand = operand;
        }

        public BooleanFormula operand() {
            return operand;
        }

        @Override
        public boolean evaluate(BitSet assignment) {
            return !operand.evaluate(assignment);
        }

        @Override
        void collectSupport(BitSet support) {
            operand.collectSupport(support);
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    public static final class Operation extends BooleanFormula {
        private final OperationType type;
        private final ImmutableList<BooleanFormula> operands;

        Operation(OperationType type, ImmutableList<BooleanFormula> operands) {
            this.type = type;
            this.operands = operands;
        }

        public OperationType type() {
            return type;
        }

        public ImmutableList<BooleanFormula> operands() {
            return operands;
        }

        @Override
        public boolean evaluate(BitSet assignment) {
            switch (type) {
                case AND:
                    return operands.stream().allMatch(operand -> operand.evaluate(assignment));
                case OR:
                    return operands.stream().anyMatch(operand -> operand.evaluate(assignment));
                case IMPLICATION:
                    return !operands.get(0).evaluate(assignment) || operands.get(1).evaluate(assignment);
                case EQUIVALENCE:
                    return operands.get(0).evaluate(assignment) == operands.get(1).evaluate(assignment);
                case XOR:
                    return operands.get(0).evaluate(assignment) != operands.get(1).evaluate(assignment);
                default:
                    throw new AssertionError(type);
            }
        }

        @Override
        void collectSupport(BitSet support) {
            for (BooleanFormula operand : operands) {
                operand.collectSupport(support);
            }
        }

        @Override
        public String toString() {
            String[] strings = new String[operands.size()];
            Arrays.setAll(strings, i -> operands.get(i).toString());
            return type + Arrays.toString(strings);
        }
    }
}
