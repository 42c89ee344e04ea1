// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that an expression or a block failed while the document was being translated: an
 * operator applied to unsuitable operands, a division by zero, a non-iterable in a loop, or a value used as a tag
 * that isn't one.
 */
public final class EvaluationErrorCondition extends Condition {
    EvaluationErrorCondition(final String message) {
        super(message);
    }
}
