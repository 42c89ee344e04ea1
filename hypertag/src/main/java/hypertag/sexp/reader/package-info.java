// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The S-expression reader.
 */
package hypertag.sexp.reader;
