// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp.reader;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that the S-expression input could not be parsed.
 */
public final class ReadErrorCondition extends Condition {
    ReadErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage);
        sourceLocation = location;
    }

    public SourceLocation location() {
        return sourceLocation;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + sourceLocation;
    }

    private final SourceLocation sourceLocation;
}
