package org.codenode.fbp.runtime;

/**
 * A fixed-arity tuple returned by processing functions with more than one output.
 * A {@code null} slot means nothing is sent on that output for the current cycle.
 */
public sealed interface ProcessResult permits ProcessResult2, ProcessResult3 {

    /**
     * @return The number of slots.
     */
    int arity();

    /**
     * @param index Zero-based slot index.
     * @return The slot value, or {@code null} if the output is skipped.
     * @throws IndexOutOfBoundsException if {@code index} is not below {@link #arity()}.
     */
    Object valueAt(int index);

    default boolean isEmpty() {
        for (int i = 0; i < arity(); i++) {
            if (valueAt(i) != null) {
                return false;
            }
        }
        return true;
    }
}
