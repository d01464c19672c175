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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decision procedure for conjunctions of equality and disequality literals over uninterpreted
 * functions. The equalities are merged into an {@link EGraph}, the conjunction is satisfiable iff
 * afterwards no disequality has both sides in the same class.
 */
public final class CongruenceClosure {
    private static final Logger logger = Logger.getLogger(CongruenceClosure.class.getName());

    private final boolean iterative;
    private final boolean integrityChecks;

    public CongruenceClosure() {
        this(ImmutableSolverConfiguration.builder().build());
    }

    public CongruenceClosure(SolverConfiguration configuration) {
        this.iterative = configuration.iterative();
        this.integrityChecks = configuration.integrityChecks();
    }

    public boolean isSatisfiable(Collection<Literal> literals) {
        return check(literals).isConsistent();
    }

    /**
     * Checks the conjunction of the given literals.
     *
     * @throws IllegalStateException if integrity checks are enabled and the closure is broken.
     */
    public TheoryResult check(Collection<Literal> literals) {
        Set<Term> terms = Literal.collectTerms(literals, new LinkedHashSet<>());
        ImmutableList.Builder<Equation> equalities = ImmutableList.builder();
        ImmutableList.Builder<Equation> disequalities = ImmutableList.builder();
        for (Literal literal : literals) {
            if (literal.isPositive()) {
                equalities.add(literal.equation());
            } else {
                disequalities.add(literal.equation());
            }
        }
        ImmutableList<Equation> equalityList = equalities.build();
        ImmutableList<Equation> disequalityList = disequalities.build();

        EGraph graph = new EGraph(terms, iterative);
        graph.mergeEqualities(equalityList);
        if (integrityChecks) {
            graph.check();
        }
        Equation violated = graph.findViolated(disequalityList);

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Checked {0} equalities and {1} disequalities: {2}", new Object[] {
                equalityList.size(), disequalityList.size(), violated == null ? "consistent" : "violated " + violated
            });
        }
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, graph.statistics());
        }
        return new TheoryResult(equalityList, disequalityList, graph.partition(), violated);
    }

    /**
     * Computes a subset of {@code equalities} which still makes the two sides of {@code violated}
     * equivalent. Each equality is dropped in turn and kept out if the remaining ones suffice.
     * The result is minimal w.r.t. removing a single equality.
     *
     * @param equalities Equalities whose congruence closure equates both sides of {@code violated}.
     */
    public List<Equation> minimizeConflict(List<Equation> equalities, Equation violated) {
        List<Equation> required = new ArrayList<>(equalities);
        int index = 0;
        while (index < required.size()) {
            List<Equation> candidate = new ArrayList<>(required.size() - 1);
            candidate.addAll(required.subList(0, index));
            candidate.addAll(required.subList(index + 1, required.size()));
            if (entails(candidate, violated)) {
                required = candidate;
            } else {
                index += 1;
            }
        }
        logger.log(Level.FINER, "Minimized conflict from {0} to {1} equalities", new Object[] {
            equalities.size(), required.size()
        });
        return required;
    }

    private boolean entails(List<Equation> equalities, Equation equation) {
        List<Term> terms = new ArrayList<>(equalities.size() * 2 + 2);
        for (Equation equality : equalities) {
            terms.add(equality.lhs());
            terms.add(equality.rhs());
        }
        terms.add(equation.lhs());
        terms.add(equation.rhs());
        EGraph graph = new EGraph(terms, iterative);
        graph.mergeEqualities(equalities);
        return graph.areEqual(equation.lhs(), equation.rhs());
    }
}
