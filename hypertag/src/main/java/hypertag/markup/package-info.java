// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Built-in tags: HTML and XHTML elements, plus a few text-processing helpers.
 */
package hypertag.markup;
