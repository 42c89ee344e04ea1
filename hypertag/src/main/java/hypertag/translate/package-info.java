// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Semantic analysis of template syntax trees and their translation into document trees.
 * <p>
 * {@link hypertag.translate.Translator} analyzes a {@link hypertag.ast.Document} once, resolving every name, into a
 * {@link hypertag.translate.Program}; executing the program produces a {@link hypertag.dom.Node.Root}.
 */
package hypertag.translate;
