package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.GeneratorFunction;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.RuntimeEnvironment;

/**
 * A generator with one output. The function is re-invoked every cycle and paces itself, for example
 * with {@link org.codenode.fbp.runtime.NodeContext#sleep(java.time.Duration)}; a {@code null} result
 * emits nothing.
 *
 * @param <R> Type of the emitted values.
 */
public class GeneratorRuntime<R> extends ChannelRuntime {

    public GeneratorRuntime(NodeOptions options, RuntimeEnvironment environment, GeneratorFunction<R> function) {
        super(options, 0, 1, (values, context) -> function.generate(context), environment);
    }

    public IReceiveChannel<R> getOutputChannel() {
        return outputAt(0);
    }
}
