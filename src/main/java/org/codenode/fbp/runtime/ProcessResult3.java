package org.codenode.fbp.runtime;

import java.util.Objects;

/**
 * Result of a processing function with three outputs. Any slot may be {@code null} to skip that output.
 */
public record ProcessResult3<U, V, W>(U first, V second, W third) implements ProcessResult {

    public static <U, V, W> ProcessResult3<U, V, W> of(U first, V second, W third) {
        return new ProcessResult3<>(first, second, third);
    }

    /**
     * @throws NullPointerException if any value is {@code null}.
     */
    public static <U, V, W> ProcessResult3<U, V, W> all(U first, V second, W third) {
        return new ProcessResult3<>(
            Objects.requireNonNull(first, "first"),
            Objects.requireNonNull(second, "second"),
            Objects.requireNonNull(third, "third"));
    }

    public static <U, V, W> ProcessResult3<U, V, W> first(U value) {
        return new ProcessResult3<>(value, null, null);
    }

    public static <U, V, W> ProcessResult3<U, V, W> second(V value) {
        return new ProcessResult3<>(null, value, null);
    }

    public static <U, V, W> ProcessResult3<U, V, W> third(W value) {
        return new ProcessResult3<>(null, null, value);
    }

    public static <U, V, W> ProcessResult3<U, V, W> none() {
        return new ProcessResult3<>(null, null, null);
    }

    @Override
    public int arity() {
        return 3;
    }

    @Override
    public Object valueAt(int index) {
        return switch (index) {
            case 0 -> first;
            case 1 -> second;
            case 2 -> third;
            default -> throw new IndexOutOfBoundsException("ProcessResult3 has no slot " + index);
        };
    }
}
