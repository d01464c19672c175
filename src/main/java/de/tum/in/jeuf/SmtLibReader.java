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
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Reads the {@code QF_UF} fragment of SMT-LIB 2 scripts. The result is the conjunction of all
 * asserted formulas.
 *
 * <p>Supported are declarations of uninterpreted sorts, functions and constants, the connectives
 * {@code not}, {@code and}, {@code or}, {@code =>}, {@code xor}, {@code =}, {@code distinct} and
 * the constants {@code true} and {@code false}. Undeclared symbols are treated as constants of an
 * uninterpreted sort. Boolean-sorted functions, definitions and incremental commands are
 * rejected.</p>
 */
public final class SmtLibReader {
    private static final String BOOL = "Bool";
    private static final Set<String> CONNECTIVES =
            ImmutableSet.of("not", "and", "or", "=>", "xor", "=", "distinct", "true", "false");
    private static final Set<String> UNSUPPORTED_CONNECTIVES = ImmutableSet.of("ite", "let", "!", "forall", "exists");
    private static final Set<String> IGNORED_COMMANDS =
            ImmutableSet.of("set-info", "set-option", "check-sat", "get-model", "get-value", "get-info", "exit");
    private static final Set<String> SUPPORTED_LOGICS = ImmutableSet.of("QF_UF", "QF_EUF", "ALL");

    private final Set<String> sorts = new HashSet<>();
    /* Arity of each declared or used function symbol, 0 for constants */
    private final Map<String, Integer> arities = new HashMap<>();
    private final List<Formula> assertions = new ArrayList<>();

    private SmtLibReader() {}

    /**
     * Reads a complete script.
     *
     * @throws InvalidFormatException if the script is malformed or uses unsupported features.
     */
    public static Formula read(Reader reader) throws IOException, InvalidFormatException {
        return readString(CharStreams.toString(reader));
    }

    public static Formula readString(String script) throws InvalidFormatException {
        SmtLibReader smtLibReader = new SmtLibReader();
        for (Expression command : new Tokenizer(script).readAll()) {
            smtLibReader.command(command);
        }
        List<Formula> assertions = smtLibReader.assertions;
        return assertions.size() == 1 ? assertions.get(0) : Formula.and(assertions);
    }

    /**
     * Parses a single formula, e.g. {@code (and (= a b) (not (= (f a) (f b))))}.
     */
    public static Formula parseFormula(String formula) throws InvalidFormatException {
        List<Expression> expressions = new Tokenizer(formula).readAll();
        if (expressions.size() != 1) {
            throw new InvalidFormatException("Expected a single formula, got " + expressions.size() + " expressions");
        }
        return new SmtLibReader().formula(expressions.get(0));
    }

    private void command(Expression command) throws InvalidFormatException {
        if (command.isAtom() || command.size() == 0 || !command.get(0).isAtom()) {
            throw new InvalidFormatException("Invalid command " + command);
        }
        String name = command.get(0).atom();
        if (IGNORED_COMMANDS.contains(name)) {
            return;
        }
        switch (name) {
            case "set-logic":
                expectSize(command, 2);
                if (!SUPPORTED_LOGICS.contains(command.get(1).atom())) {
                    throw new InvalidFormatException("Unsupported logic " + command.get(1));
                }
                break;
            case "declare-sort":
                if (command.size() < 2 || command.size() > 3
                        || (command.size() == 3 && !"0".equals(command.get(2).atom()))) {
                    throw new InvalidFormatException("Only nullary sorts are supported: " + command);
                }
                sorts.add(symbol(command.get(1)));
                break;
            case "declare-fun": {
                expectSize(command, 4);
                Expression argumentSorts = command.get(2);
                if (argumentSorts.isAtom()) {
                    throw new InvalidFormatException("Invalid argument sorts in " + command);
                }
                for (Expression sort : argumentSorts.children()) {
                    checkSort(sort, command);
                }
                checkSort(command.get(3), command);
                declare(symbol(command.get(1)), argumentSorts.size());
                break;
            }
            case "declare-const":
                expectSize(command, 3);
                checkSort(command.get(2), command);
                declare(symbol(command.get(1)), 0);
                break;
            case "assert":
                expectSize(command, 2);
                assertions.add(formula(command.get(1)));
                break;
            default:
                throw new InvalidFormatException("Unsupported command " + name);
        }
    }

    private static void expectSize(Expression command, int size) throws InvalidFormatException {
        if (command.size() != size) {
            throw new InvalidFormatException("Expected " + (size - 1) + " arguments in " + command);
        }
    }

    private void checkSort(Expression sort, Expression command) throws InvalidFormatException {
        if (!sort.isAtom()) {
            throw new InvalidFormatException("Parametric sort " + sort + " in " + command);
        }
        if (BOOL.equals(sort.atom())) {
            throw new InvalidFormatException("Boolean-sorted symbols are not supported: " + command);
        }
        if (!sorts.contains(sort.atom())) {
            throw new InvalidFormatException("Undeclared sort " + sort + " in " + command);
        }
    }

    private void declare(String symbol, int arity) throws InvalidFormatException {
        if (CONNECTIVES.contains(symbol) || UNSUPPORTED_CONNECTIVES.contains(symbol)) {
            throw new InvalidFormatException("Cannot redeclare " + symbol);
        }
        if (arities.putIfAbsent(symbol, arity) != null) {
            throw new InvalidFormatException("Symbol " + symbol + " declared twice");
        }
    }

    private static String symbol(Expression expression) throws InvalidFormatException {
        if (!expression.isAtom()) {
            throw new InvalidFormatException("Expected symbol, got " + expression);
        }
        return expression.atom();
    }

    // Formulas and terms

    private static boolean isBooleanShaped(Expression expression) {
        if (expression.isAtom()) {
            return "true".equals(expression.atom()) || "false".equals(expression.atom());
        }
        return expression.size() > 0
                && expression.get(0).isAtom()
                && CONNECTIVES.contains(expression.get(0).atom());
    }

    /**
     * Translates a formula expression, using an explicit stack of partially translated
     * sub-expressions. Operands are translated left to right.
     */
    private Formula formula(Expression expression) throws InvalidFormatException {
        if (expression.isAtom()) {
            return formulaAtom(expression);
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(formulaFrame(expression));
        while (true) {
            Frame frame = stack.peek();
            int next = frame.translated();
            if (next < frame.operands.size()) {
                Expression operand = frame.operands.get(next);
                if (frame.formulaOperands) {
                    if (operand.isAtom()) {
                        frame.formulas.add(formulaAtom(operand));
                    } else {
                        stack.push(formulaFrame(operand));
                    }
                } else if (operand.isAtom()) {
                    frame.terms.add(termAtom(operand));
                } else {
                    stack.push(termFrame(operand));
                }
                continue;
            }
            stack.pop();
            if (frame.term) {
                stack.peek().terms.add(Term.apply(frame.head, frame.terms));
                continue;
            }
            Formula formula = combine(frame);
            if (stack.isEmpty()) {
                return formula;
            }
            stack.peek().formulas.add(formula);
        }
    }

    private static Formula formulaAtom(Expression expression) throws InvalidFormatException {
        switch (expression.atom()) {
            case "true":
                return Formula.constant(true);
            case "false":
                return Formula.constant(false);
            default:
                throw new InvalidFormatException("Symbol " + expression + " is not a formula");
        }
    }

    private Term termAtom(Expression expression) throws InvalidFormatException {
        String name = expression.atom();
        if (CONNECTIVES.contains(name) || UNSUPPORTED_CONNECTIVES.contains(name)) {
            throw new InvalidFormatException("Boolean " + name + " used as term");
        }
        checkArity(name, 0, expression);
        return Term.variable(name);
    }

    private static void checkSupported(String head) throws InvalidFormatException {
        if (UNSUPPORTED_CONNECTIVES.contains(head)) {
            throw new InvalidFormatException("Unsupported connective " + head);
        }
    }

    /**
     * Validates the head and operand count of a formula and determines whether its operands are
     * formulas or terms.
     */
    private Frame formulaFrame(Expression expression) throws InvalidFormatException {
        if (expression.size() == 0 || !expression.get(0).isAtom()) {
            throw new InvalidFormatException("Invalid formula " + expression);
        }
        String connective = expression.get(0).atom();
        checkSupported(connective);
        List<Expression> operands = expression.children().subList(1, expression.size());
        switch (connective) {
            case "not":
                checkOperandCount(expression, operands, 1, 1);
                return new Frame(connective, operands, false, true);
            case "and":
            case "or":
                return new Frame(connective, operands, false, true);
            case "=>":
            case "xor":
                checkOperandCount(expression, operands, 2, Integer.MAX_VALUE);
                return new Frame(connective, operands, false, true);
            case "=": {
                checkOperandCount(expression, operands, 2, Integer.MAX_VALUE);
                boolean booleanShaped = isBooleanShaped(operands.get(0));
                for (Expression operand : operands) {
                    if (isBooleanShaped(operand) != booleanShaped) {
                        throw new InvalidFormatException("Mixed boolean and term operands in equality " + operands);
                    }
                }
                return new Frame(connective, operands, false, booleanShaped);
            }
            case "distinct":
                checkOperandCount(expression, operands, 2, Integer.MAX_VALUE);
                return new Frame(connective, operands, false, false);
            default:
                if (arities.containsKey(connective)) {
                    throw new InvalidFormatException("Term " + expression + " is not a formula");
                }
                throw new InvalidFormatException("Unknown connective " + connective);
        }
    }

    private Frame termFrame(Expression expression) throws InvalidFormatException {
        if (expression.size() == 0 || !expression.get(0).isAtom()) {
            throw new InvalidFormatException("Invalid term " + expression);
        }
        String symbol = expression.get(0).atom();
        checkSupported(symbol);
        if (CONNECTIVES.contains(symbol)) {
            throw new InvalidFormatException("Formula " + expression + " used as term");
        }
        List<Expression> arguments = expression.children().subList(1, expression.size());
        if (arguments.isEmpty()) {
            throw new InvalidFormatException("Application without arguments " + expression);
        }
        checkArity(symbol, arguments.size(), expression);
        return new Frame(symbol, arguments, true, false);
    }

    private static Formula combine(Frame frame) {
        List<Formula> formulas = frame.formulas;
        switch (frame.head) {
            case "not":
                return Formula.not(formulas.get(0));
            case "and":
                return Formula.and(formulas);
            case "or":
                return Formula.or(formulas);
            case "=>": {
                Formula result = formulas.get(formulas.size() - 1);
                for (int i = formulas.size() - 2; i >= 0; i--) {
                    result = Formula.implies(formulas.get(i), result);
                }
                return result;
            }
            case "xor": {
                Formula result = formulas.get(0);
                for (int i = 1; i < formulas.size(); i++) {
                    result = Formula.xor(result, formulas.get(i));
                }
                return result;
            }
            case "=": {
                List<Formula> chain = new ArrayList<>(frame.operands.size() - 1);
                if (frame.formulaOperands) {
                    for (int i = 0; i + 1 < formulas.size(); i++) {
                        chain.add(Formula.iff(formulas.get(i), formulas.get(i + 1)));
                    }
                } else {
                    List<Term> terms = frame.terms;
                    for (int i = 0; i + 1 < terms.size(); i++) {
                        chain.add(Formula.equal(terms.get(i), terms.get(i + 1)));
                    }
                }
                return chain.size() == 1 ? chain.get(0) : Formula.and(chain);
            }
            case "distinct": {
                List<Term> terms = frame.terms;
                List<Formula> disequalities = new ArrayList<>();
                for (int i = 0; i < terms.size(); i++) {
                    for (int j = i + 1; j < terms.size(); j++) {
                        disequalities.add(Formula.distinct(terms.get(i), terms.get(j)));
                    }
                }
                return disequalities.size() == 1 ? disequalities.get(0) : Formula.and(disequalities);
            }
            default:
                throw new AssertionError(frame.head);
        }
    }

    private static void checkOperandCount(Expression expression, List<Expression> operands, int minimum, int maximum)
            throws InvalidFormatException {
        if (operands.size() < minimum || operands.size() > maximum) {
            throw new InvalidFormatException(String.format(
                    "Arity mismatch: %s expects %s operands, got %d in %s",
                    expression.get(0), minimum == maximum ? String.valueOf(minimum) : "at least " + minimum,
                    operands.size(), expression));
        }
    }

    private void checkArity(String symbol, int arity, Expression expression) throws InvalidFormatException {
        Integer known = arities.putIfAbsent(symbol, arity);
        if (known != null && known != arity) {
            throw new InvalidFormatException(String.format(
                    "Arity mismatch: %s has arity %d, used with %d arguments in %s", symbol, known, arity, expression));
        }
    }

    /**
     * A formula or function application whose operands are being translated.
     */
    private static final class Frame {
        final String head;
        final List<Expression> operands;
        final boolean term;
        final boolean formulaOperands;
        final List<Formula> formulas = new ArrayList<>();
        final List<Term> terms = new ArrayList<>();

        Frame(String head, List<Expression> operands, boolean term, boolean formulaOperands) {
            this.head = head;
            this.operands = operands;
            this.term = term;
            this.formulaOperands = formulaOperands;
        }

        int translated() {
            return formulas.size() + terms.size();
        }
    }

    // S-expressions

    private static final class Expression {
        @Nullable
        private final String atom;
        private final ImmutableList<Expression> children;

        private Expression(@Nullable String atom, ImmutableList<Expression> children) {
            this.atom = atom;
            this.children = children;
        }

        static Expression atom(String atom) {
            return new Expression(atom, ImmutableList.of());
        }

        static Expression list(List<Expression> children) {
            return new Expression(null, ImmutableList.copyOf(children));
        }

        boolean isAtom() {
            return atom != null;
        }

        @Nullable
        String atom() {
            return atom;
        }

        ImmutableList<Expression> children() {
            return children;
        }

        int size() {
            return children.size();
        }

        Expression get(int index) {
            return children.get(index);
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            Deque<Object> pending = new ArrayDeque<>();
            pending.push(this);
            while (!pending.isEmpty()) {
                Object next = pending.pop();
                if (next instanceof String) {
                    builder.append((String) next);
                    continue;
                }
                Expression expression = (Expression) next;
                if (expression.atom != null) {
                    builder.append(expression.atom);
                    continue;
                }
                builder.append('(');
                pending.push(")");
                for (int i = expression.children.size() - 1; i >= 0; i--) {
                    pending.push(expression.children.get(i));
                    if (i > 0) {
                        pending.push(" ");
                    }
                }
            }
            return builder.toString();
        }
    }

    private static final class Tokenizer {
        private final String input;
        private int position = 0;

        Tokenizer(String input) {
            this.input = input;
        }

        List<Expression> readAll() throws InvalidFormatException {
            List<Expression> expressions = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (position == input.length()) {
                    return expressions;
                }
                expressions.add(read());
            }
        }

        private void skipWhitespace() {
            while (position < input.length()) {
                char c = input.charAt(position);
                if (c == ';') {
                    while (position < input.length() && input.charAt(position) != '\n') {
                        position++;
                    }
                } else if (Character.isWhitespace(c)) {
                    position++;
                } else {
                    return;
                }
            }
        }

        private Expression read() throws InvalidFormatException {
            List<List<Expression>> stack = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (position == input.length()) {
                    throw new InvalidFormatException("Unbalanced parentheses: unexpected end of input");
                }
                char c = input.charAt(position);
                Expression completed;
                if (c == '(') {
                    position++;
                    stack.add(new ArrayList<>());
                    continue;
                }
                if (c == ')') {
                    if (stack.isEmpty()) {
                        throw new InvalidFormatException("Unbalanced parentheses: unexpected ) at " + position);
                    }
                    position++;
                    completed = Expression.list(stack.remove(stack.size() - 1));
                } else {
                    completed = Expression.atom(readAtom());
                }
                if (stack.isEmpty()) {
                    return completed;
                }
                stack.get(stack.size() - 1).add(completed);
            }
        }

        private String readAtom() throws InvalidFormatException {
            char first = input.charAt(position);
            if (first == '|' || first == '"') {
                int end = input.indexOf(first, position + 1);
                if (end < 0) {
                    throw new InvalidFormatException("Unterminated " + first + " at " + position);
                }
                String content = input.substring(position + 1, end);
                position = end + 1;
                return first == '|' ? content : '"' + content + '"';
            }
            int start = position;
            while (position < input.length()) {
                char c = input.charAt(position);
                if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ';' || c == '|' || c == '"') {
                    break;
                }
                position++;
            }
            return input.substring(start, position);
        }
    }
}
