package org.codenode.fbp.runtime;

/**
 * Processing function of a node with 3 inputs and at least one output.
 *
 * @param <R> The output value for one output, or a {@link ProcessResult} for two or three outputs.
 *            Returning {@code null} emits nothing for the cycle.
 */
@FunctionalInterface
public interface ProcessFunction3<A, B, C, R> {

    R apply(A input1, B input2, C input3) throws Exception;
}
