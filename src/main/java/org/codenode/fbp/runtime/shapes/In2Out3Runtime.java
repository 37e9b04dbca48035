package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessFunction2;
import org.codenode.fbp.runtime.ProcessResult3;
import org.codenode.fbp.runtime.RuntimeEnvironment;

public class In2Out3Runtime<A, B, U, V, W> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public In2Out3Runtime(NodeOptions options, RuntimeEnvironment environment, ProcessFunction2<A, B, ProcessResult3<U, V, W>> function) {
        super(options, 2, 3, (values, context) -> function.apply((A) values[0], (B) values[1]), environment);
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
