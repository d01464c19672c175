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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the equality atoms of a formula by propositions. The numbering is local to one
 * abstraction, which lives as long as a single solve call. An atom and its mirrored version
 * ({@code a = b} and {@code b = a}) are mapped to the same proposition.
 */
public final class BooleanAbstraction {
    private final Map<Equation, Integer> propositions = new HashMap<>();
    private final List<Equation> atoms = new ArrayList<>();
    private final BooleanFormula formula;

    private BooleanAbstraction(Formula formula) {
        this.formula = abstractFormula(formula);
    }

    public static BooleanAbstraction of(Formula formula) {
        return new BooleanAbstraction(formula);
    }

    private BooleanFormula abstractFormula(Formula formula) {
        if (formula instanceof Formula.Constant) {
            return BooleanFormula.constant(((Formula.Constant) formula).value());
        }
        if (formula instanceof Formula.Atom) {
            return BooleanFormula.proposition(propositionOf(((Formula.Atom) formula).equation()));
        }
        if (formula instanceof Formula.Not) {
            return BooleanFormula.not(abstractFormula(((Formula.Not) formula).operand()));
        }
        if (formula instanceof Formula.Operation) {
            Formula.Operation operation = (Formula.Operation) formula;
            List<BooleanFormula> operands = new ArrayList<>(operation.operands().size());
            for (Formula operand : operation.operands()) {
                operands.add(abstractFormula(operand));
            }
            return BooleanFormula.operation(operation.type(), operands);
        }
        throw new IllegalArgumentException("Unknown type " + formula.getClass().getSimpleName());
    }

    private int propositionOf(Equation atom) {
        Equation oriented = atom.oriented();
        Integer proposition = propositions.get(oriented);
        if (proposition != null) {
            return proposition;
        }
        int fresh = atoms.size();
        atoms.add(oriented);
        propositions.put(oriented, fresh);
        return fresh;
    }

    /**
     * The abstracted formula.
     */
    public BooleanFormula formula() {
        return formula;
    }

    public int propositionCount() {
        return atoms.size();
    }

    /**
     * Returns the atoms, where the atom at index {@code i} is abstracted by proposition {@code i}.
     */
    public ImmutableList<Equation> atoms() {
        return ImmutableList.copyOf(atoms);
    }

    public Equation atom(int proposition) {
        if (proposition < 0 || proposition >= atoms.size()) {
            throw new IndexOutOfBoundsException("No proposition " + proposition);
        }
        return atoms.get(proposition);
    }

    /**
     * Returns the proposition of {@code atom} (in either orientation) or -1 if the atom does not
     * occur in the abstracted formula.
     */
    public int proposition(Equation atom) {
        return propositions.getOrDefault(atom.oriented(), -1);
    }

    /**
     * The theory literal corresponding to assigning {@code value} to {@code proposition}: the
     * equality if true, the disequality if false.
     */
    public Literal literal(int proposition, boolean value) {
        return Literal.of(atom(proposition), value);
    }

    /**
     * Projects a boolean assignment to the conjunction of theory literals, containing one literal
     * for every proposition.
     */
    public ImmutableList<Literal> project(BitSet assignment) {
        ImmutableList.Builder<Literal> literals = ImmutableList.builderWithExpectedSize(atoms.size());
        for (int proposition = 0; proposition < atoms.size(); proposition++) {
            literals.add(literal(proposition, assignment.get(proposition)));
        }
        return literals.build();
    }

    public ImmutableMap<Equation, Boolean> model(BitSet assignment) {
        ImmutableMap.Builder<Equation, Boolean> model = ImmutableMap.builderWithExpectedSize(atoms.size());
        for (int proposition = 0; proposition < atoms.size(); proposition++) {
            model.put(atoms.get(proposition), assignment.get(proposition));
        }
        return model.build();
    }
}
