package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.RuntimeEnvironment;
import org.codenode.fbp.runtime.SinkFunction1;

/**
 * A sink consuming one input for its side effect.
 *
 * @param <A> Type of the consumed values.
 */
public class SinkRuntime<A> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public SinkRuntime(NodeOptions options, RuntimeEnvironment environment, SinkFunction1<A> function) {
        super(options, 1, 0, (values, context) -> {
            function.accept((A) values[0]);
            return null;
        }, environment);
    }

    public IReceiveChannel<A> getInputChannel() {
        return inputAt(0);
    }

    public void setInputChannel(IReceiveChannel<A> channel) {
        bindInput(0, channel);
    }
}
