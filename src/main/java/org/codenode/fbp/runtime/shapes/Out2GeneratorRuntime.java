package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.GeneratorFunction;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessResult2;
import org.codenode.fbp.runtime.RuntimeEnvironment;

/**
 * A generator with two outputs, selecting per cycle which of them receive a value.
 */
public class Out2GeneratorRuntime<U, V> extends ChannelRuntime {

    public Out2GeneratorRuntime(NodeOptions options, RuntimeEnvironment environment, GeneratorFunction<ProcessResult2<U, V>> function) {
        super(options, 0, 2, (values, context) -> function.generate(context), environment);
    }

    public IReceiveChannel<U> getOutputChannel1() {
        return outputAt(0);
    }

    public IReceiveChannel<V> getOutputChannel2() {
        return outputAt(1);
    }
}
