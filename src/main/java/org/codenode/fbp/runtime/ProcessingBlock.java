package org.codenode.fbp.runtime;

/**
 * The body of a runtime's scheduled task. It runs until it returns, throws or is interrupted.
 */
@FunctionalInterface
public interface ProcessingBlock {

    void run() throws Exception;
}
