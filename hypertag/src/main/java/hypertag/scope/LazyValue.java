// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value computed on first access and remembered afterwards; used for hypertag attribute defaults, which are
 * evaluated only when the body reads them.
 */
public final class LazyValue<T> implements Supplier<T> {
    private LazyValue(final Supplier<? extends T> supplier) {
        this.supplier = supplier;
    }

    public static <T> LazyValue<T> of(final Supplier<? extends T> supplier) {
        return new LazyValue<>(supplier);
    }

    /**
     * Returns the value, computing it first if this is the first access.
     */
    @Override
    @SuppressWarnings("nullness:return") // value is set whenever supplier is cleared.
    public T get() {
        final var currentSupplier = supplier;
        if (currentSupplier != null) {
            value = currentSupplier.get();
            supplier = null;
        }
        return value;
    }

    public boolean isEvaluated() {
        return supplier == null;
    }

    private @Nullable Supplier<? extends T> supplier;
    private @Nullable T value = null;
}
