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

import java.util.Collection;
import java.util.Set;

/**
 * An equation with a polarity: positive literals are equalities, negative ones disequalities.
 */
public final class Literal {
    private final Equation equation;
    private final boolean positive;

    private Literal(Equation equation, boolean positive) {
        this.equation = equation;
        this.positive = positive;
    }

    public static Literal of(Equation equation, boolean positive) {
        return new Literal(equation, positive);
    }

    public static Literal equal(Term lhs, Term rhs) {
        return new Literal(Equation.of(lhs, rhs), true);
    }

    public static Literal distinct(Term lhs, Term rhs) {
        return new Literal(Equation.of(lhs, rhs), false);
    }

    public Equation equation() {
        return equation;
    }

    public boolean isPositive() {
        return positive;
    }

    public Literal negate() {
        return new Literal(equation, !positive);
    }

    /**
     * Adds the terms of all given literals, including their subterms, to {@code terms}.
     */
    static <S extends Set<Term>> S collectTerms(Collection<Literal> literals, S terms) {
        for (Literal literal : literals) {
            Term.collectSubterms(literal.equation.lhs(), terms);
            Term.collectSubterms(literal.equation.rhs(), terms);
        }
        return terms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Literal)) {
            return false;
        }
        Literal literal = (Literal) o;
        return positive == literal.positive && equation.equals(literal.equation);
    }

    @Override
    public int hashCode() {
        return 2 * equation.hashCode() + (positive ? 1 : 0);
    }

    @Override
    public String toString() {
        return positive
                ? equation.toString()
                : equation.lhs() + " != " + equation.rhs();
    }
}
