package org.codenode.fbp.runtime.shapes;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.runtime.ChannelRuntime;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessFunction1;
import org.codenode.fbp.runtime.ProcessResult2;
import org.codenode.fbp.runtime.RuntimeEnvironment;

/**
 * One input, two outputs. The function returns a {@link ProcessResult2} whose {@code null} slots are not sent.
 */
public class In1Out2Runtime<A, U, V> extends ChannelRuntime {

    @SuppressWarnings("unchecked")
    public In1Out2Runtime(NodeOptions options, RuntimeEnvironment environment, ProcessFunction1<A, ProcessResult2<U, V>> function) {
        super(options, 1, 2, (values, context) -> function.apply((A) values[0]), environment);
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
}
