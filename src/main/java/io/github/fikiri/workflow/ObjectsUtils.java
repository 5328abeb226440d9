package io.github.fikiri.workflow;

import org.jetbrains.annotations.NotNull;

/**
 * Argument checks that let the caller choose the exception type.
 */
public final class ObjectsUtils {

    private ObjectsUtils() {
    }

    /**
     * Returns {@code obj} if it is not {@code null}, otherwise throws {@code exception}.
     *
     * @param obj       value to check
     * @param exception exception to throw when {@code obj} is {@code null}
     * @return the checked value
     */
    public static <T, E extends RuntimeException> @NotNull T requireNonNull(T obj, @NotNull E exception) {
        if (obj == null) throw exception;
        return obj;
    }

    /**
     * Throws {@code exception} unless {@code condition} holds.
     */
    public static <E extends RuntimeException> void requireTrue(boolean condition, @NotNull E exception) {
        if (!condition) throw exception;
    }
}
