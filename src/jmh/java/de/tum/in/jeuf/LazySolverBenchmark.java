package de.tum.in.jeuf;

import java.util.ArrayList;
import java.util.List;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class LazySolverBenchmark extends BaseBenchmark {
    /**
     * {@code n + 1} pigeons in {@code n} holes: every pigeon equals some hole, holes are pairwise
     * distinct and pigeons are pairwise distinct.
     */
    static Formula pigeonholeFormula(int holes) {
        List<Formula> operands = new ArrayList<>();
        for (int pigeon = 0; pigeon <= holes; pigeon++) {
            List<Formula> choices = new ArrayList<>(holes);
            for (int hole = 0; hole < holes; hole++) {
                choices.add(Formula.equal(Term.variable("p" + pigeon), Term.variable("h" + hole)));
            }
            operands.add(Formula.or(choices));
            for (int other = 0; other < pigeon; other++) {
                operands.add(Formula.distinct(Term.variable("p" + pigeon), Term.variable("p" + other)));
            }
        }
        return Formula.and(operands);
    }

    /**
     * A diamond chain: each step {@code x_i = x_(i+1)} holds via {@code y_i} or via {@code f(y_i)},
     * while the ends are distinct.
     */
    static Formula diamondFormula(int length) {
        List<Formula> operands = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            Term x = Term.variable("x" + i);
            Term y = Term.variable("y" + i);
            Term next = Term.variable("x" + (i + 1));
            operands.add(Formula.or(
                    Formula.and(Formula.equal(x, y), Formula.equal(y, next)),
                    Formula.and(Formula.equal(x, Term.apply("f", y)), Formula.equal(Term.apply("f", y), next))));
        }
        operands.add(Formula.distinct(Term.variable("x0"), Term.variable("x" + length)));
        return Formula.and(operands);
    }

    @Benchmark
    public static void pigeonhole(SolverState state, Blackhole bh) throws InvalidFormatException {
        bh.consume(state.solver().solve(pigeonholeFormula(3)));
    }

    @Benchmark
    public static void diamonds(SolverState state, Blackhole bh) throws InvalidFormatException {
        bh.consume(state.solver().solve(diamondFormula(6)));
    }
}
