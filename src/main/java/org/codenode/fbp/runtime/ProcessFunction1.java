package org.codenode.fbp.runtime;

/**
 * Processing function of a node with 1 input and at least one output.
 *
 * @param <R> The output value for one output, or a {@link ProcessResult} for two or three outputs.
 *            Returning {@code null} emits nothing for the cycle.
 */
@FunctionalInterface
public interface ProcessFunction1<A, R> {

    R apply(A input) throws Exception;
}
