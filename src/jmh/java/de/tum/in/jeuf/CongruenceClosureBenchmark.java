package de.tum.in.jeuf;

import java.util.ArrayList;
import java.util.List;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class CongruenceClosureBenchmark extends BaseBenchmark {
    private static Term chain(Term base, int length) {
        Term term = base;
        for (int i = 0; i < length; i++) {
            term = Term.apply("f", term);
        }
        return term;
    }

    @Benchmark
    public static void parallelChains(Blackhole bh) {
        // Merging the bases of two chains propagates along their full length
        int length = 5_000;
        Term left = chain(Term.variable("a"), length);
        Term right = chain(Term.variable("b"), length);
        EGraph graph = new EGraph(List.of(left, right), true);
        graph.merge(graph.node(Term.variable("a")), graph.node(Term.variable("b")));
        bh.consume(graph.classCount());
    }

    @Benchmark
    public static void cyclicChain(SolverState state, Blackhole bh) {
        // f^n(a) = a and f^(n+1)(a) = a collapse the whole chain
        int length = 2_000;
        Term a = Term.variable("a");
        Term top = chain(a, length + 1);
        Term below = top.arguments().get(0);
        EGraph graph = new EGraph(List.of(top), state.iterative());
        graph.mergeEqualities(List.of(Equation.of(below, a), Equation.of(top, a)));
        bh.consume(graph.classCount());
    }

    @Benchmark
    public static void transitiveLiterals(SolverState state, Blackhole bh) {
        int count = 2_000;
        List<Literal> literals = new ArrayList<>(count + 1);
        for (int i = 0; i < count; i++) {
            literals.add(Literal.equal(
                    Term.apply("g", Term.variable("x" + i)), Term.apply("g", Term.variable("x" + (i + 1)))));
            literals.add(Literal.equal(Term.variable("x" + i), Term.variable("x" + (i + 1))));
        }
        literals.add(Literal.distinct(Term.variable("x0"), Term.variable("x" + count)));
        bh.consume(state.solver().isSatisfiable(literals));
    }
}
