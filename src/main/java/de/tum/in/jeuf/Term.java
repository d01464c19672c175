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
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable term over an uninterpreted signature, either a {@link Variable} or a function
 * {@link Application}. Terms are compared structurally; hash code and depth are computed once on
 * construction.
 *
 * <p>Terms are totally ordered by depth, then name, then arity and finally arguments in
 * lexicographic order.</p>
 */
public abstract class Term implements Comparable<Term> {
    private final String name;
    private final int depth;
    private final int hashCode;

    Term(String name, int depth, int hashCode) {
        this.name = name;
        this.depth = depth;
        this.hashCode = hashCode;
    }

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static Application apply(String symbol, Term... arguments) {
        return new Application(symbol, ImmutableList.copyOf(arguments));
    }

    public static Application apply(String symbol, Collection<? extends Term> arguments) {
        return new Application(symbol, ImmutableList.copyOf(arguments));
    }

    /**
     * The variable name or the function symbol.
     */
    public String name() {
        return name;
    }

    public int depth() {
        return depth;
    }

    public abstract boolean isApplication();

    public abstract ImmutableList<Term> arguments();

    public int arity() {
        return arguments().size();
    }

    /**
     * Returns all distinct subterms of this term, including the term itself. Arguments are listed
     * before the terms using them.
     */
    public Set<Term> subterms() {
        Set<Term> terms = new LinkedHashSet<>();
        collectSubterms(this, terms);
        return terms;
    }

    /**
     * Adds all subterms of {@code root} to {@code terms}, without recursing on the term depth.
     */
    static void collectSubterms(Term root, Set<Term> terms) {
        if (terms.contains(root)) {
            return;
        }
        Deque<Term> stack = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        stack.push(root);
        expanded.push(Boolean.FALSE);
        while (!stack.isEmpty()) {
            Term current = stack.pop();
            boolean childrenDone = expanded.pop();
            if (terms.contains(current)) {
                continue;
            }
            if (childrenDone || !current.isApplication()) {
                terms.add(current);
                continue;
            }
            stack.push(current);
            expanded.push(Boolean.TRUE);
            ImmutableList<Term> arguments = current.arguments();
            for (int i = arguments.size() - 1; i >= 0; i--) {
                Term argument = arguments.get(i);
                if (!terms.contains(argument)) {
                    stack.push(argument);
                    expanded.push(Boolean.FALSE);
                }
            }
        }
    }

    @Override
    public int compareTo(Term o) {
        // Argument pairs still to compare, left term on top
        Deque<Term> pending = new ArrayDeque<>();
        pending.push(o);
        pending.push(this);
        while (!pending.isEmpty()) {
            Term left = pending.pop();
            Term right = pending.pop();
            if (left == right) {
                continue;
            }
            int result = Integer.compare(left.depth, right.depth);
            if (result != 0) {
                return result;
            }
            result = left.name.compareTo(right.name);
            if (result != 0) {
                return result;
            }
            result = Boolean.compare(left.isApplication(), right.isApplication());
            if (result != 0) {
                return result;
            }
            ImmutableList<Term> arguments = left.arguments();
            ImmutableList<Term> otherArguments = right.arguments();
            result = Integer.compare(arguments.size(), otherArguments.size());
            if (result != 0) {
                return result;
            }
            for (int i = arguments.size() - 1; i >= 0; i--) {
                pending.push(otherArguments.get(i));
                pending.push(arguments.get(i));
            }
        }
        return 0;
    }

    /**
     * Structural equality of two terms, without recursing on the term depth.
     */
    static boolean structurallyEqual(Term term, Term other) {
        Deque<Term> pending = new ArrayDeque<>();
        pending.push(other);
        pending.push(term);
        while (!pending.isEmpty()) {
            Term left = pending.pop();
            Term right = pending.pop();
            if (left == right) {
                continue;
            }
            if (left.hashCode != right.hashCode
                    || left.depth != right.depth
                    || left.isApplication() != right.isApplication()
                    || !left.name.equals(right.name)) {
                return false;
            }
            ImmutableList<Term> arguments = left.arguments();
            ImmutableList<Term> otherArguments = right.arguments();
            if (arguments.size() != otherArguments.size()) {
                return false;
            }
            for (int i = arguments.size() - 1; i >= 0; i--) {
                pending.push(otherArguments.get(i));
                pending.push(arguments.get(i));
            }
        }
        return true;
    }

    static String print(Term root) {
        StringBuilder builder = new StringBuilder();
        // Either terms to print or separators
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof String) {
                builder.append((String) next);
                continue;
            }
            Term term = (Term) next;
            builder.append(term.name);
            if (!term.isApplication()) {
                continue;
            }
            builder.append('(');
            pending.push(")");
            ImmutableList<Term> arguments = term.arguments();
            for (int i = arguments.size() - 1; i >= 0; i--) {
                pending.push(arguments.get(i));
                if (i > 0) {
                    pending.push(", ");
                }
            }
        }
        return builder.toString();
    }

    @Override
    public final int hashCode() {
        return hashCode;
    }

    public static final class Variable extends Term {
        Variable(String name) {
            super(checkName(name), 0, name.hashCode());
        }

        @Override
        public boolean isApplication() {
            return false;
        }

        @Override
        public ImmutableList<Term> arguments() {
            return ImmutableList.of();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Variable)) {
                return false;
            }
            Variable variable = (Variable) o;
            return hashCode() == variable.hashCode() && name().equals(variable.name());
        }

        @Override
        public String toString() {
            return name();
        }
    }

    public static final class Application extends Term {
        private final ImmutableList<Term> arguments;

        Application(String symbol, ImmutableList<Term> arguments) {
            super(checkName(symbol), depthOf(arguments), 31 * Objects.hash(symbol, arguments) + 1);
            this.arguments = arguments;
        }

        private static int depthOf(ImmutableList<Term> arguments) {
            int depth = 0;
            for (Term argument : arguments) {
                depth = Math.max(depth, argument.depth());
            }
            return depth + 1;
        }

        public String symbol() {
            return name();
        }

        @Override
        public boolean isApplication() {
            return true;
        }

        @Override
        public ImmutableList<Term> arguments() {
            return arguments;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Application)) {
                return false;
            }
            return structurallyEqual(this, (Application) o);
        }

        @Override
        public String toString() {
            return print(this);
        }
    }

    private static String checkName(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty symbol name");
        }
        return name;
    }
}
