package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.GeneratorFunction;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessResult3;
import org.codenode.fbp.runtime.RuntimeEnvironment;

/**
 * A generator with three outputs.
 */
public class Out3GeneratorRuntime<U, V, W> extends ChannelRuntime {

    public Out3GeneratorRuntime(NodeOptions options, RuntimeEnvironment environment, GeneratorFunction<ProcessResult3<U, V, W>> function) {
        super(options, 0, 3, (values, context) -> function.generate(context), environment);
    }

    public IReceiveChannel<U> getOutputChannel1() {
        return outputAt(0);
    }

    public IReceiveChannel<V> getOutputChannel2() {
        return outputAt(1);
    }

    public IReceiveChannel<W> getOutputChannel3() {
        return outputAt(2);
    }
}
