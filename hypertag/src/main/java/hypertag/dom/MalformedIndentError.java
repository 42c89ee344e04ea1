// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

/**
 * Thrown when node indentations don't nest: a child's absolute indentation doesn't extend its parent's, or a node is
 * rendered while its indentation is still absolute.
 * <p>
 * Translation always assigns consistent indentation, so this signals a bug in whoever built the tree, and extends
 * {@link AssertionError}.
 */
public final class MalformedIndentError extends AssertionError {
    MalformedIndentError(final String message) {
        super(message);
    }
}
