package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessFunction1;
import org.codenode.fbp.runtime.RuntimeEnvironment;

/**
 * Transforms each input value into at most one output value. Returning {@code null} drops the value,
 * which makes this shape a filter as well.
 *
 * @param <A> Input type.
 * @param <R> Output type.
 */
public class TransformerRuntime<A, R> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public TransformerRuntime(NodeOptions options, RuntimeEnvironment environment, ProcessFunction1<A, R> function) {
        super(options, 1, 1, (values, context) -> function.apply((A) values[0]), environment);
    }

    public IReceiveChannel<A> getInputChannel() {
        return inputAt(0);
    }

    public void setInputChannel(IReceiveChannel<A> channel) {
        bindInput(0, channel);
    }

    public IReceiveChannel<R> getOutputChannel() {
        return outputAt(0);
    }
}
