package org.codenode.fbp.runtime;

/**
 * Processing function of a node without inputs.
 * <p>
 * It is invoked once per cycle and decides itself when to produce, typically by calling
 * {@link NodeContext#sleep(java.time.Duration)} before returning a value.
 *
 * @param <R> The output value for one output, or a {@link ProcessResult} for two or three outputs.
 *            Returning {@code null} emits nothing for the cycle.
 */
@FunctionalInterface
public interface GeneratorFunction<R> {

    R generate(NodeContext context) throws Exception;
}
