package io.github.eutro.rcopt.core.passes.misc;

import io.github.eutro.rcopt.core.passes.IRPass;
import io.github.eutro.rcopt.core.passes.InPlaceIRPass;
import io.github.eutro.rcopt.core.ssa.Function;
import io.github.eutro.rcopt.core.ssa.Module;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Lifts passes which operate on functions into ones that operate on whole modules.
 */
public class ForPass {
    /**
     * Lift a function pass to operate on a module, one function after another.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static Functions liftFunctions(IRPass<Function, Function> pass) {
        return new Functions(pass, false);
    }

    /**
     * Lift a function pass to operate on a module, running it on several functions at once.
     * <p>
     * The pass must only touch the function it is given.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static Functions liftFunctionsParallel(IRPass<Function, Function> pass) {
        return new Functions(pass, true);
    }

    /**
     * A function pass lifted to operate on a full module.
     */
    public static class Functions implements InPlaceIRPass<Module> {
        private final IRPass<Function, Function> pass;
        private final boolean parallel;

        private Functions(IRPass<Function, Function> pass, boolean parallel) {
            this.pass = pass;
            this.parallel = parallel;
        }

        @Override
        public void runInPlace(Module module) {
            List<Function> functions = module.functions;
            IntStream indices = IntStream.range(0, functions.size());
            if (parallel) indices = indices.parallel();
            List<Function> results = indices
                    .mapToObj(i -> runOn(functions.get(i), i))
                    .collect(Collectors.toList());
            if (!pass.isInPlace()) {
                for (int i = 0; i < results.size(); i++) {
                    functions.set(i, results.get(i));
                }
            }
        }

        private Function runOn(Function func, int i) {
            try {
                return pass.run(func);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in element " + i));
                throw t;
            }
        }
    }
}
