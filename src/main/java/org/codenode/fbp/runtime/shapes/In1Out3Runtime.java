package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessFunction1;
import org.codenode.fbp.runtime.ProcessResult3;
import org.codenode.fbp.runtime.RuntimeEnvironment;

public class In1Out3Runtime<A, U, V, W> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public In1Out3Runtime(NodeOptions options, RuntimeEnvironment environment, ProcessFunction1<A, ProcessResult3<U, V, W>> function) {
        super(options, 1, 3, (values, context) -> function.apply((A) values[0]), environment);
    }

    public IReceiveChannel<A> getInputChannel() {
        return inputAt(0);
    }

    public void setInputChannel(IReceiveChannel<A> channel) {
        bindInput(0, channel);
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
