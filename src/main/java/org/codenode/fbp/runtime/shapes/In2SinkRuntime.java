package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.RuntimeEnvironment;
import org.codenode.fbp.runtime.SinkFunction2;

/**
 * A sink joining two inputs: the function sees one value from each input per cycle.
 */
public class In2SinkRuntime<A, B> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public In2SinkRuntime(NodeOptions options, RuntimeEnvironment environment, SinkFunction2<A, B> function) {
        super(options, 2, 0, (values, context) -> {
            function.accept((A) values[0], (B) values[1]);
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
}
