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

/**
 * An equality atom {@code lhs = rhs}. Equality is direction-sensitive, use {@link #oriented()}
 * to obtain a representative which is the same for {@code a = b} and {@code b = a}.
 */
public final class Equation {
    private final Term lhs;
    private final Term rhs;

    private Equation(Term lhs, Term rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static Equation of(Term lhs, Term rhs) {
        return new Equation(lhs, rhs);
    }

    public Term lhs() {
        return lhs;
    }

    public Term rhs() {
        return rhs;
    }

    public boolean isTrivial() {
        return lhs.equals(rhs);
    }

    /**
     * Returns this equation with the smaller term (w.r.t. the term order) on the left.
     */
    public Equation oriented() {
        return lhs.compareTo(rhs) <= 0 ? this : new Equation(rhs, lhs);
    }

    public Literal positive() {
        return Literal.of(this, true);
    }

    public Literal negative() {
        return Literal.of(this, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Equation)) {
            return false;
        }
        Equation equation = (Equation) o;
        return lhs.equals(equation.lhs) && rhs.equals(equation.rhs);
    }

    @Override
    public int hashCode() {
        return 31 * lhs.hashCode() + rhs.hashCode();
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
