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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Boolean combination of equality atoms over uninterpreted terms.
 */
@SuppressWarnings("PMD.GodClass")
public abstract class Formula {
    private static final Formula TRUE = new Constant(true);
    private static final Formula FALSE = new Constant(false);

    Formula() {}

    public static Formula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Formula atom(Equation equation) {
        return new Atom(equation);
    }

    public static Formula equal(Term lhs, Term rhs) {
        return new Atom(Equation.of(lhs, rhs));
    }

    public static Formula distinct(Term lhs, Term rhs) {
        return not(equal(lhs, rhs));
    }

    public static Formula literal(Literal literal) {
        Formula atom = atom(literal.equation());
        return literal.isPositive() ? atom : not(atom);
    }

    public static Formula not(Formula formula) {
        return new Not(formula);
    }

    public static Formula and(Formula... operands) {
        return new Operation(OperationType.AND, ImmutableList.copyOf(operands));
    }

    public static Formula and(Collection<? extends Formula> operands) {
        return new Operation(OperationType.AND, ImmutableList.copyOf(operands));
    }

    public static Formula or(Formula... operands) {
        return new Operation(OperationType.OR, ImmutableList.copyOf(operands));
    }

    public static Formula or(Collection<? extends Formula> operands) {
        return new Operation(OperationType.OR, ImmutableList.copyOf(operands));
    }

    public static Formula implies(Formula left, Formula right) {
        return new Operation(OperationType.IMPLICATION, ImmutableList.of(left, right));
    }

    public static Formula iff(Formula left, Formula right) {
        return new Operation(OperationType.EQUIVALENCE, ImmutableList.of(left, right));
    }

    public static Formula xor(Formula left, Formula right) {
        return new Operation(OperationType.XOR, ImmutableList.of(left, right));
    }

    public static Formula conjunction(Collection<Literal> literals) {
        List<Formula> operands = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            operands.add(literal(literal));
        }
        return and(operands);
    }

    /**
     * Evaluates this formula where each atom has the value given by {@code atomValue}.
     */
    public abstract boolean evaluate(Predicate<Equation> atomValue);

    abstract void collectAtoms(Set<Equation> atoms);

    /**
     * Returns all distinct atoms of this formula in order of their first occurrence.
     */
    public Set<Equation> atoms() {
        Set<Equation> atoms = new LinkedHashSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    /**
     * Returns all distinct terms of this formula, including all subterms.
     */
    public Set<Term> terms() {
        Set<Term> terms = new LinkedHashSet<>();
        for (Equation atom : atoms()) {
            Term.collectSubterms(atom.lhs(), terms);
            Term.collectSubterms(atom.rhs(), terms);
        }
        return terms;
    }

    /**
     * Checks that every symbol is used consistently, i.e. with a single arity and either only as
     * variable or only as function.
     *
     * @throws InvalidFormatException if some symbol is used inconsistently.
     */
    public void checkSignature() throws InvalidFormatException {
        Map<String, Term> firstUse = new HashMap<>();
        for (Term term : terms()) {
            Term previous = firstUse.putIfAbsent(term.name(), term);
            if (previous == null) {
                continue;
            }
            if (previous.isApplication() != term.isApplication()) {
                throw new InvalidFormatException(String.format(
                        "Symbol %s used both as variable (%s) and function (%s)",
                        term.name(), previous.isApplication() ? term : previous, previous.isApplication() ? previous : term));
            }
            if (previous.arity() != term.arity()) {
                throw new InvalidFormatException(String.format(
                        "Arity mismatch for %s: %s has %d arguments, %s has %d",
                        term.name(), previous, previous.arity(), term, term.arity()));
            }
        }
    }

    /**
     * If this formula is a conjunction of (possibly negated) atoms, returns these literals.
     */
    public Optional<List<Literal>> asLiteralConjunction() {
        List<Literal> literals = new ArrayList<>();
        return collectConjunction(this, literals) ? Optional.of(literals) : Optional.empty();
    }

    private static boolean collectConjunction(Formula formula, List<Literal> literals) {
        if (formula instanceof Atom) {
            literals.add(((Atom) formula).equation.positive());
            return true;
        }
        if (formula instanceof Not && ((Not) formula).operand instanceof Atom) {
            literals.add(((Atom) ((Not) formula).operand).equation.negative());
            return true;
        }
        if (formula instanceof Constant) {
            return ((Constant) formula).value;
        }
        if (formula instanceof Operation && ((Operation) formula).type == OperationType.AND) {
            for (Formula operand : ((Operation) formula).operands) {
                if (!collectConjunction(operand, literals)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    public enum OperationType {
        AND("and"),
        OR("or"),
        IMPLICATION("=>"),
        EQUIVALENCE("<=>"),
        XOR("xor");

        private final String symbol;

        OperationType(String symbol) {
            this.symbol = symbol;
        }

        boolean isBinary() {
            return this == IMPLICATION || this == EQUIVALENCE || this == XOR;
        }
    }

    public static final class Constant extends Formula {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public boolean evaluate(Predicate<Equation> atomValue) {
            return value;
        }

        @Override
        void collectAtoms(Set<Equation> atoms) {
            // empty
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Constant && value == ((Constant) o).value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    public static final class Atom extends Formula {
        private final Equation equation;

        Atom(Equation equation) {
            this.equation = Objects.requireNonNull(equation);
        }

        public Equation equation() {
            return equation;
        }

        @Override
        public boolean evaluate(Predicate<Equation> atomValue) {
            return atomValue.test(equation);
        }

        @Override
        void collectAtoms(Set<Equation> atoms) {
            atoms.add(equation);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Atom && equation.equals(((Atom) o).equation));
        }

        @Override
        public int hashCode() {
            return equation.hashCode();
        }

        @Override
        public String toString() {
            return "(" + equation + ")";
        }
    }

    public static final class Not extends Formula {
        private final Formula operand;

        Not(Formula operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        public Formula operand() {
            return operand;
        }

        @Override
        public boolean evaluate(Predicate<Equation> atomValue) {
            return !operand.evaluate(atomValue);
        }

        @Override
        void collectAtoms(Set<Equation> atoms) {
            operand.collectAtoms(atoms);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Not && operand.equals(((Not) o).operand));
        }

        @Override
        public int hashCode() {
            return ~operand.hashCode();
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    public static final class Operation extends Formula {
        private final OperationType type;
        private final ImmutableList<Formula> operands;

        Operation(OperationType type, ImmutableList<Formula> operands) {
            if (type.isBinary() && operands.size() != 2) {
                throw new IllegalArgumentException(type + " requires two operands, got " + operands.size());
            }
            this.type = type;
            this.operands = operands;
        }

        public OperationType type() {
            return type;
        }

        public ImmutableList<Formula> operands() {
            return operands;
        }

        @Override
        public boolean evaluate(Predicate<Equation> atomValue) {
            switch (type) {
                case AND:
                    for (Formula operand : operands) {
                        if (!operand.evaluate(atomValue)) {
                            return false;
                        }
                    }
                    return true;
                case OR:
                    for (Formula operand : operands) {
                        if (operand.evaluate(atomValue)) {
                            return true;
                        }
                    }
                    return false;
                case IMPLICATION:
                    return !operands.get(0).evaluate(atomValue) || operands.get(1).evaluate(atomValue);
                case EQUIVALENCE:
                    return operands.get(0).evaluate(atomValue) == operands.get(1).evaluate(atomValue);
                case XOR:
                    return operands.get(0).evaluate(atomValue) != operands.get(1).evaluate(atomValue);
                default:
                    throw new AssertionError(type);
            }
        }

        @Override
        void collectAtoms(Set<Equation> atoms) {
            for (Formula operand : operands) {
                operand.collectAtoms(atoms);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Operation)) {
                return false;
            }
            Operation operation = (Operation) o;
            return type == operation.type && operands.equals(operation.operands);
        }

        @Override
        public int hashCode() {
            return 31 * type.hashCode() + operands.hashCode();
        }

        @Override
        public String toString() {
            if (operands.isEmpty()) {
                return type == OperationType.AND ? "true" : "false";
            }
            String[] strings = new String[operands.size()];
            Arrays.setAll(strings, i -> operands.get(i).toString());
            return "(" + String.join(" " + type.symbol + " ", strings) + ")";
        }
    }
}
