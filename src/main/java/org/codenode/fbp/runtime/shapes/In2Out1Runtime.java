package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessFunction2;
import org.codenode.fbp.runtime.RuntimeEnvironment;

/**
 * Joins two inputs into one output. Each cycle waits for a value on both inputs before the function runs,
 * so values are paired strictly in arrival order per input.
 *
 * @param <A> Type of input 1.
 * @param <B> Type of input 2.
 * @param <R> Output type.
 */
public class In2Out1Runtime<A, B, R> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public In2Out1Runtime(NodeOptions options, RuntimeEnvironment environment, ProcessFunction2<A, B, R> function) {
        super(options, 2, 1, (values, context) -> function.apply((A) values[0], (B) values[1]), environment);
    }

    public IReceiveChannel<A> getInputChannel1() {
        return inputAt(0);
    }

    public void setInputChannel1(IReceiveChannel<A> channel) {
        bindInput(0, channel);
    }

    public IReceiveChannel<B> getInputChannel2() {
        return inputAt(1);
    }

    public void setInputChannel2(IReceiveChannel<B> channel) {
        bindInput(1, channel);
    }

    public IReceiveChannel<R> getOutputChannel() {
        return outputAt(0);
    }
}
