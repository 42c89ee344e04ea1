// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable carrying a non-local transfer of control to a {@link Restart}.
 * <p>
 * Public only so that methods can declare {@code throws Unwind}; never catch or throw it by hand. It extends
 * {@link Throwable} directly because it's neither a recoverable exception nor a serious error, and code that catches
 * {@link Exception} must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart point " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized; transient only to keep static analysis quiet.
    private final transient @NotNull Restart target;
}
