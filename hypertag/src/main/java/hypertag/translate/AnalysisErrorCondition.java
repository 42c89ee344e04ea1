// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that a syntax tree is well-formed but can't be given a meaning, such as a hypertag
 * defined inside a control block or a parameter declared twice.
 */
public final class AnalysisErrorCondition extends Condition {
    AnalysisErrorCondition(final String message) {
        super(message);
    }
}
