package org.codenode.fbp.runtime;

@FunctionalInterface
public interface SinkFunction2<A, B> {

    void accept(A input1, B input2) throws Exception;
}
