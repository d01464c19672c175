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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;

/**
 * Random terms, literals and formulas together with naive reference procedures to compare
 * against.
 */
final class Generator {
    static final Term a = Term.variable("a");
    static final Term b = Term.variable("b");
    static final Term c = Term.variable("c");
    static final Term d = Term.variable("d");

    private static final String[] VARIABLES = {"a", "b", "c", "d"};

    private Generator() {}

    static Term f(Term argument) {
        return Term.apply("f", argument);
    }

    /**
     * Applies {@code f} {@code depth} times to {@code term}.
     */
    static Term fChain(Term term, int depth) {
        Term chain = term;
        for (int i = 0; i < depth; i++) {
            chain = f(chain);
        }
        return chain;
    }

    static Term g(Term left, Term right) {
        return Term.apply("g", left, right);
    }

    /**
     * A random term over the variables a to d, unary f and binary g.
     */
    static Term randomTerm(Random random, int maximalDepth) {
        if (maximalDepth == 0 || random.nextInt(3) == 0) {
            return Term.variable(VARIABLES[random.nextInt(VARIABLES.length)]);
        }
        if (random.nextBoolean()) {
            return f(randomTerm(random, maximalDepth - 1));
        }
        return g(randomTerm(random, maximalDepth - 1), randomTerm(random, maximalDepth - 1));
    }

    static Equation randomEquation(Random random, int maximalDepth) {
        return Equation.of(randomTerm(random, maximalDepth), randomTerm(random, maximalDepth));
    }

    static List<Literal> randomLiterals(Random random, int count, int maximalDepth, double positiveProbability) {
        List<Literal> literals = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            literals.add(Literal.of(randomEquation(random, maximalDepth), random.nextDouble() < positiveProbability));
        }
        return literals;
    }

    /**
     * A random formula whose atoms are taken from {@code atoms}.
     */
    static Formula randomFormula(Random random, List<Equation> atoms, int depth) {
        if (depth == 0) {
            Formula atom = Formula.atom(atoms.get(random.nextInt(atoms.size())));
            return random.nextBoolean() ? atom : Formula.not(atom);
        }
        Formula left = randomFormula(random, atoms, depth - 1);
        Formula right = randomFormula(random, atoms, depth - 1);
        switch (random.nextInt(6)) {
            case 0:
            case 1:
                return Formula.and(left, right);
            case 2:
            case 3:
                return Formula.or(left, right);
            case 4:
                return Formula.implies(left, right);
            default:
                return random.nextBoolean() ? Formula.iff(left, right) : Formula.xor(left, right);
        }
    }

    /**
     * Computes the congruence closure by saturating: repeatedly joins all pairs of applications
     * with equivalent arguments until nothing changes.
     */
    static Map<Term, Integer> naiveClosure(Collection<Term> roots, Collection<Equation> equalities) {
        Set<Term> terms = new LinkedHashSet<>();
        for (Term root : roots) {
            terms.addAll(root.subterms());
        }
        Map<Term, Integer> classes = new HashMap<>();
        int index = 0;
        for (Term term : terms) {
            classes.put(term, index++);
        }
        for (Equation equality : equalities) {
            relabel(classes, classes.get(equality.lhs()), classes.get(equality.rhs()));
        }
        List<Term> list = new ArrayList<>(terms);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Term first : list) {
                for (Term second : list) {
                    if (!classes.get(first).equals(classes.get(second)) && naiveCongruent(classes, first, second)) {
                        relabel(classes, classes.get(first), classes.get(second));
                        changed = true;
                    }
                }
            }
        }
        return classes;
    }

    private static boolean naiveCongruent(Map<Term, Integer> classes, Term first, Term second) {
        if (!first.isApplication() || !second.isApplication() || !first.name().equals(second.name())
                || first.arity() != second.arity()) {
            return false;
        }
        for (int i = 0; i < first.arity(); i++) {
            if (!classes.get(first.arguments().get(i)).equals(classes.get(second.arguments().get(i)))) {
                return false;
            }
        }
        return true;
    }

    private static void relabel(Map<Term, Integer> classes, int from, int to) {
        classes.replaceAll((term, label) -> label == from ? to : label);
    }

    static boolean naiveSatisfiable(Collection<Literal> literals) {
        Set<Term> terms = new HashSet<>();
        List<Equation> equalities = new ArrayList<>();
        for (Literal literal : literals) {
            terms.add(literal.equation().lhs());
            terms.add(literal.equation().rhs());
            if (literal.isPositive()) {
                equalities.add(literal.equation());
            }
        }
        Map<Term, Integer> classes = naiveClosure(terms, equalities);
        for (Literal literal : literals) {
            if (!literal.isPositive()
                    && classes.get(literal.equation().lhs()).equals(classes.get(literal.equation().rhs()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decides the formula by enumerating all assignments of its atoms.
     */
    static boolean naiveSatisfiable(Formula formula) {
        List<Equation> atoms = new ArrayList<>(formula.atoms());
        Iterator<BitSet> assignments = new PowerSetIterator(atoms.size());
        while (assignments.hasNext()) {
            BitSet assignment = assignments.next();
            if (!formula.evaluate(atom -> assignment.get(atoms.indexOf(atom)))) {
                continue;
            }
            List<Literal> literals = new ArrayList<>(atoms.size());
            for (int i = 0; i < atoms.size(); i++) {
                literals.add(Literal.of(atoms.get(i), assignment.get(i)));
            }
            if (naiveSatisfiable(literals)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Iterates all subsets of {0, ..., length - 1}, returning the same (modified) instance.
     */
    static final class PowerSetIterator implements Iterator<BitSet> {
        private final int length;
        private final BitSet next;
        private boolean hasNext = true;
        private boolean first = true;

        PowerSetIterator(int length) {
            this.length = length;
            this.next = new BitSet(length);
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public BitSet next() {
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            if (first) {
                first = false;
                hasNext = length > 0;
                return next;
            }
            for (int i = 0; i < length; i++) {
                if (next.get(i)) {
                    next.clear(i);
                } else {
                    next.set(i);
                    hasNext = next.cardinality() < length;
                    return next;
                }
            }
            throw new AssertionError();
        }
    }
}
