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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class BooleanAbstractionTest {
    @Test
    public void testSymmetricAtomsShareProposition() {
        Formula formula = Formula.or(Formula.equal(a, b), Formula.and(Formula.equal(b, a), Formula.distinct(f(a), c)));
        BooleanAbstraction abstraction = BooleanAbstraction.of(formula);

        assertThat(abstraction.propositionCount(), is(2));
        assertThat(abstraction.proposition(Equation.of(a, b)), is(0));
        assertThat(abstraction.proposition(Equation.of(b, a)), is(0));
        assertThat(abstraction.proposition(Equation.of(c, f(a))), is(1));
        assertThat(abstraction.proposition(Equation.of(a, c)), is(-1));
        assertThat(abstraction.atom(1), is(Equation.of(c, f(a))));
        assertThat(abstraction.formula().support().cardinality(), is(2));
        assertThrows(IndexOutOfBoundsException.class, () -> abstraction.atom(2));
    }

    @Test
    public void testProjection() {
        Formula formula = Formula.and(Formula.equal(a, b), Formula.or(Formula.equal(b, c), Formula.constant(false)));
        BooleanAbstraction abstraction = BooleanAbstraction.of(formula);
        BitSet assignment = new BitSet();
        assignment.set(0);

        assertThat(abstraction.project(assignment), contains(Literal.equal(a, b), Literal.distinct(b, c)));
        assertThat(abstraction.model(assignment).get(Equation.of(a, b)), is(true));
        assertThat(abstraction.model(assignment).get(Equation.of(b, c)), is(false));
        assertThat(abstraction.literal(1, true), is(Literal.equal(b, c)));
    }

    @Test
    public void testAbstractionPreservesEvaluation() {
        Random random = new Random(5L);
        List<Equation> atoms = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            atoms.add(Generator.randomEquation(random, 1));
        }
        for (int round = 0; round < 100; round++) {
            Formula formula = Generator.randomFormula(random, atoms, 3);
            BooleanAbstraction abstraction = BooleanAbstraction.of(formula);
            Iterator<BitSet> assignments = new Generator.PowerSetIterator(abstraction.propositionCount());
            while (assignments.hasNext()) {
                BitSet assignment = assignments.next();
                boolean expected = formula.evaluate(atom -> assignment.get(abstraction.proposition(atom)));
                assertThat(abstraction.formula().evaluate(assignment), is(expected));
            }
        }
    }
}
