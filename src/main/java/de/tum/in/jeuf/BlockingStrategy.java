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
 * Determines which literals of a theory-inconsistent boolean model end up in the clause blocking
 * it. Every strategy yields a clause falsified by the blocked model.
 */
public enum BlockingStrategy {
    /** Negate the complete model. */
    MODEL,
    /** Negate all equalities of the model and the violated disequality. */
    CONFLICT,
    /** Like {@link #CONFLICT}, but drop each equality not needed to violate the disequality. */
    MINIMAL
}
