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
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of checking a conjunction of literals with {@link CongruenceClosure}.
 */
public final class TheoryResult {
    private final ImmutableList<Equation> equalities;
    private final ImmutableList<Equation> disequalities;
    private final ImmutableSet<ImmutableSet<Term>> partition;
    @Nullable
    private final Equation violated;

    TheoryResult(
            ImmutableList<Equation> equalities,
            ImmutableList<Equation> disequalities,
            ImmutableSet<ImmutableSet<Term>> partition,
            @Nullable Equation violated) {
        this.equalities = equalities;
        this.disequalities = disequalities;
        this.partition = partition;
        this.violated = violated;
    }

    public boolean isConsistent() {
        return violated == null;
    }

    /**
     * The asserted equalities, in the order they were merged.
     */
    public ImmutableList<Equation> equalities() {
        return equalities;
    }

    public ImmutableList<Equation> disequalities() {
        return disequalities;
    }

    /**
     * The congruence closure of the equalities, as partition of all terms.
     */
    public ImmutableSet<ImmutableSet<Term>> partition() {
        return partition;
    }

    /**
     * The first disequality whose sides are equivalent, if the literals are inconsistent.
     */
    public Optional<Equation> violatedDisequality() {
        return Optional.ofNullable(violated);
    }

    @Override
    public String toString() {
        return isConsistent() ? "consistent " + partition : "inconsistent, violated " + violated;
    }
}
