// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import hypertag.util.condition.Condition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition type indicating that something other than a node, a sequence, or a collection of those ended up where
 * document content was expected.
 */
public final class StructuralTypeCondition extends Condition {
    StructuralTypeCondition(final @Nullable Object offender) {
        super("Found " + describe(offender) + " instead of a node as an element of the document tree");
        offenderType = (offender == null) ? "null" : offender.getClass().getName();
    }

    /**
     * The name of the offending value's class.
     */
    public String offenderType() {
        return offenderType;
    }

    private static String describe(final @Nullable Object offender) {
        if (offender instanceof String string) {
            return "a string \"" + string + "\"";
        }
        return (offender == null) ? "null" : "an object of type " + offender.getClass().getName();
    }

    private final String offenderType;
}
