package io.github.plangc.api;

import io.github.plangc.api.events.*;
import io.github.plangc.core.ast.ProgramNode;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * The entrypoint for compiling parsed PLang programs.
 * <p>
 * A compiler holds no state of its own besides its options and listeners,
 * so programs may be compiled on several threads at once.
 */
public class PolicyCompiler extends EventSupplier<CompilerEvent> {
    private final CompilerOptions options;

    /**
     * Construct a compiler with the default options.
     */
    public PolicyCompiler() {
        this(CompilerOptions.builder().build());
    }

    /**
     * Construct a compiler with the given options.
     *
     * @param options The options.
     */
    public PolicyCompiler(@NotNull CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Submit a program for compilation. Nothing happens until the compilation is {@link PolicyCompilation#run() run}.
     *
     * @param program The program.
     * @return The compilation.
     */
    @Contract(pure = true)
    @NotNull
    public PolicyCompilation submit(@NotNull ProgramNode program) {
        return new PolicyCompilation(this, program);
    }

    /**
     * Submit and immediately run a compilation.
     *
     * @param program The program.
     * @return The result.
     */
    public CompilationResult compile(@NotNull ProgramNode program) {
        return submit(program).run();
    }

    /**
     * Get a dispatcher on which listeners are added to every compilation this compiler runs.
     * <p>
     * Removing such a listener stops it being added to later compilations; compilations
     * already running keep it.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<ModuleCompileEvent> lift() {
        return new EventDispatcher<ModuleCompileEvent>() {
            @Override
            public <T extends ModuleCompileEvent> Runnable listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                return PolicyCompiler.this.listen(RunCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect the plan of every compilation run from now on into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<ScheduledEvent> plansAsQueue() {
        BlockingQueue<ScheduledEvent> queue = new LinkedBlockingQueue<>();
        lift().listen(ScheduledEvent.class, queue::add);
        return queue;
    }
}
