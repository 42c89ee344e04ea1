// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp.reader;

/**
 * Where in the input a read error happened.
 *
 * @param lineNumber       The line being read, counting from 1.
 * @param topLevelFormLine The line the enclosing top-level form starts at.
 */
public record SourceLocation(int lineNumber, int topLevelFormLine) {
    @Override
    public String toString() {
        return "In line " + lineNumber + ", within top-level form starting at line " + topLevelFormLine;
    }
}
