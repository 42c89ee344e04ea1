// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * S-expressions: the interchange form templates can be stored in before conversion to the syntax tree.
 */
package hypertag.sexp;
