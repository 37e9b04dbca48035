package org.codenode.fbp.runtime;

import java.util.Objects;

/**
 * Result of a processing function with two outputs.
 *
 * @param first  Value for output 1, or {@code null} to skip it.
 * @param second Value for output 2, or {@code null} to skip it.
 */
public record ProcessResult2<U, V>(U first, V second) implements ProcessResult {

    public static <U, V> ProcessResult2<U, V> of(U first, V second) {
        return new ProcessResult2<>(first, second);
    }

    /**
     * @throws NullPointerException if either value is {@code null}.
     */
    public static <U, V> ProcessResult2<U, V> both(U first, V second) {
        return new ProcessResult2<>(Objects.requireNonNull(first, "first"), Objects.requireNonNull(second, "second"));
    }

    public static <U, V> ProcessResult2<U, V> first(U value) {
        return new ProcessResult2<>(value, null);
    }

    public static <U, V> ProcessResult2<U, V> second(V value) {
        return new ProcessResult2<>(null, value);
    }

    public static <U, V> ProcessResult2<U, V> none() {
        return new ProcessResult2<>(null, null);
    }

    @Override
    public int arity() {
        return 2;
    }

    @Override
    public Object valueAt(int index) {
        return switch (index) {
            case 0 -> first;
            case 1 -> second;
            default -> throw new IndexOutOfBoundsException("ProcessResult2 has no slot " + index);
        };
    }
}
