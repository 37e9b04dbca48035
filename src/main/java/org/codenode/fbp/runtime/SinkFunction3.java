package org.codenode.fbp.runtime;

@FunctionalInterface
public interface SinkFunction3<A, B, C> {

    void accept(A input1, B input2, C input3) throws Exception;
}
