package org.codenode.fbp.runtime;

import org.codenode.fbp.runtime.shapes.GeneratorRuntime;
import org.codenode.fbp.runtime.shapes.In1Out2Runtime;
import org.codenode.fbp.runtime.shapes.In1Out3Runtime;
import org.codenode.fbp.runtime.shapes.In2Out1Runtime;
import org.codenode.fbp.runtime.shapes.In2Out2Runtime;
import org.codenode.fbp.runtime.shapes.In2Out3Runtime;
import org.codenode.fbp.runtime.shapes.In2SinkRuntime;
import org.codenode.fbp.runtime.shapes.In3Out1Runtime;
import org.codenode.fbp.runtime.shapes.In3Out2Runtime;
import org.codenode.fbp.runtime.shapes.In3Out3Runtime;
import org.codenode.fbp.runtime.shapes.In3SinkRuntime;
import org.codenode.fbp.runtime.shapes.Out2GeneratorRuntime;
import org.codenode.fbp.runtime.shapes.Out3GeneratorRuntime;
import org.codenode.fbp.runtime.shapes.SinkRuntime;
import org.codenode.fbp.runtime.shapes.TransformerRuntime;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Creates node runtimes, one method per input/output arity.
 * <p>
 * All runtimes created by one factory share its settings, registry and clock. Returned runtimes are idle;
 * wire their input channels to other runtimes' output channels, then start them.
 * <pre>
 * RuntimeFactory factory = new RuntimeFactory(settings, registry);
 * GeneratorRuntime&lt;Long&gt; ticks = factory.createGenerator(NodeOptions.named("ticks"), ctx -&gt; {
 *     ctx.sleep(Duration.ofSeconds(1));
 *     return ctx.elapsed().toSeconds();
 * });
 * SinkRuntime&lt;Long&gt; printer = factory.createSink(NodeOptions.named("printer"), System.out::println);
 * printer.setInputChannel(ticks.getOutputChannel());
 * </pre>
 */
public class RuntimeFactory {

    private final RuntimeEnvironment environment;

    public RuntimeFactory(RuntimeSettings settings, RuntimeRegistry registry, TimeSource timeSource) {
        this.environment = new RuntimeEnvironment(settings, registry, timeSource);
    }

    public RuntimeFactory(RuntimeSettings settings, RuntimeRegistry registry) {
        this(settings, registry, TimeSource.system());
    }

    public RuntimeEnvironment getEnvironment() {
        return environment;
    }

    public RuntimeRegistry getRegistry() {
        return environment.registry();
    }

    // Generators

    public <R> GeneratorRuntime<R> createGenerator(NodeOptions options, GeneratorFunction<R> function) {
        return new GeneratorRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <U, V> Out2GeneratorRuntime<U, V> createOut2Generator(NodeOptions options, GeneratorFunction<ProcessResult2<U, V>> function) {
        return new Out2GeneratorRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <U, V, W> Out3GeneratorRuntime<U, V, W> createOut3Generator(NodeOptions options, GeneratorFunction<ProcessResult3<U, V, W>> function) {
        return new Out3GeneratorRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    // One input

    public <A, R> TransformerRuntime<A, R> createTransformer(NodeOptions options, ProcessFunction1<A, R> function) {
        return new TransformerRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    /**
     * A transformer that forwards the values accepted by {@code predicate} and drops the others.
     */
    public <T> TransformerRuntime<T, T> createFilter(NodeOptions options, Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new TransformerRuntime<>(options, environment, value -> predicate.test(value) ? value : null);
    }

    public <A, U, V> In1Out2Runtime<A, U, V> createIn1Out2Processor(NodeOptions options, ProcessFunction1<A, ProcessResult2<U, V>> function) {
        return new In1Out2Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, U, V, W> In1Out3Runtime<A, U, V, W> createIn1Out3Processor(NodeOptions options, ProcessFunction1<A, ProcessResult3<U, V, W>> function) {
        return new In1Out3Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A> SinkRuntime<A> createSink(NodeOptions options, SinkFunction1<A> function) {
        return new SinkRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    // Two inputs

    public <A, B, R> In2Out1Runtime<A, B, R> createIn2Out1Processor(NodeOptions options, ProcessFunction2<A, B, R> function) {
        return new In2Out1Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, B, U, V> In2Out2Runtime<A, B, U, V> createIn2Out2Processor(NodeOptions options, ProcessFunction2<A, B, ProcessResult2<U, V>> function) {
        return new In2Out2Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, B, U, V, W> In2Out3Runtime<A, B, U, V, W> createIn2Out3Processor(NodeOptions options, ProcessFunction2<A, B, ProcessResult3<U, V, W>> function) {
        return new In2Out3Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, B> In2SinkRuntime<A, B> createIn2Sink(NodeOptions options, SinkFunction2<A, B> function) {
        return new In2SinkRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    // Three inputs

    public <A, B, C, R> In3Out1Runtime<A, B, C, R> createIn3Out1Processor(NodeOptions options, ProcessFunction3<A, B, C, R> function) {
        return new In3Out1Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, B, C, U, V> In3Out2Runtime<A, B, C, U, V> createIn3Out2Processor(NodeOptions options, ProcessFunction3<A, B, C, ProcessResult2<U, V>> function) {
        return new In3Out2Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, B, C, U, V, W> In3Out3Runtime<A, B, C, U, V, W> createIn3Out3Processor(NodeOptions options, ProcessFunction3<A, B, C, ProcessResult3<U, V, W>> function) {
        return new In3Out3Runtime<>(options, environment, Objects.requireNonNull(function, "function"));
    }

    public <A, B, C> In3SinkRuntime<A, B, C> createIn3Sink(NodeOptions options, SinkFunction3<A, B, C> function) {
        return new In3SinkRuntime<>(options, environment, Objects.requireNonNull(function, "function"));
    }
}
