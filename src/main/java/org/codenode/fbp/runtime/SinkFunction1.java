package org.codenode.fbp.runtime;

/**
 * Side-effect-only function of a node with one input and no outputs.
 */
@FunctionalInterface
public interface SinkFunction1<A> {

    void accept(A input) throws Exception;
}
