// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that a void tag or hypertag was given a non-empty body.
 */
public final class VoidBodyCondition extends Condition {
    /**
     * Initializes a new {@code VoidBodyCondition} for the tag with the given name.
     */
    public VoidBodyCondition(final String tagName) {
        super("Non-empty body passed to a void tag '" + tagName + "'");
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    private final String tagName;
}
