// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that an S-expression could not be converted into a syntax tree node.
 */
public final class FormConversionErrorCondition extends Condition {
    FormConversionErrorCondition(final String message) {
        super(message);
    }
}
