package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.RuntimeEnvironment;
import org.codenode.fbp.runtime.SinkFunction3;

/**
 * A sink joining three inputs.
 */
public class In3SinkRuntime<A, B, C> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public In3SinkRuntime(NodeOptions options, RuntimeEnvironment environment, SinkFunction3<A, B, C> function) {
        super(options, 3, 0, (values, context) -> {
            function.accept((A) values[0], (B) values[1], (C) values[2]);
            return null;
        }, environment);
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

    public IReceiveChannel<C> getInputChannel3() {
        return inputAt(2);
    }

    public void setInputChannel3(IReceiveChannel<C> channel) {
        bindInput(2, channel);
    }
}
