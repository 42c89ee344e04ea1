// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The output document tree.
 * <p>
 * A template translates to a tree of {@link hypertag.dom.Node nodes}; each node knows its own indentation relative
 * to its parent and whether it starts on a new line, and renders itself to text. Tags plug into rendering through the
 * {@link hypertag.dom.Tag} contract, which is all the tree knows about markup languages.
 */
package hypertag.dom;
