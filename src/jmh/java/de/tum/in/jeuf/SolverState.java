package de.tum.in.jeuf;

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class SolverState {
    @Param({"true", "false"})
    private boolean iterative;

    @Param({"MODEL", "CONFLICT", "MINIMAL"})
    private BlockingStrategy blockingStrategy;

    @SuppressWarnings("NotNullFieldNotInitialized")
    private LazySolver solver;

    @Setup(Level.Iteration)
    public void setUpSolver() {
        solver = Solvers.create(ImmutableSolverConfiguration.builder()
                .iterative(iterative)
                .blockingStrategy(blockingStrategy)
                .build());
    }

    public LazySolver solver() {
        return solver;
    }

    public boolean iterative() {
        return iterative;
    }
}
