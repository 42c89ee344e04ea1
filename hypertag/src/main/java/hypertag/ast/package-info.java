// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The syntax tree of a template, as produced by a parser and consumed by {@link hypertag.translate.Translator}.
 * <p>
 * The tree is immutable. Besides the records themselves, {@link hypertag.ast.FormConverter} builds it from the
 * S-expression interchange form read by {@link hypertag.sexp.reader.Reader}.
 */
package hypertag.ast;
