// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * All user-facing template errors are reported as conditions: a handler sees the condition <em>before</em> the
 * stack unwinds, so it can inspect the active {@link hypertag.util.Trace traces} and pick a {@link Restart}, for
 * instance the next alternative of a {@code try} block.
 */
package hypertag.util.condition;
