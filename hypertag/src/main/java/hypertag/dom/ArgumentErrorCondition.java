// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that a tag occurrence passed attributes the tag doesn't accept.
 */
public final class ArgumentErrorCondition extends Condition {
    /**
     * Initializes a new {@code ArgumentErrorCondition} about the tag with the given name.
     */
    public ArgumentErrorCondition(final String tagName, final String message) {
        super(message);
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    private final String tagName;
}
