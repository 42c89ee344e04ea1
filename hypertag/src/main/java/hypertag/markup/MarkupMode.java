// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

/**
 * The markup dialect of the built-in element tags.
 */
public enum MarkupMode {
    /**
     * HTML: true boolean attributes render as a bare name; element names are known in lower and upper case.
     */
    HTML,
    /**
     * XHTML: true boolean attributes render as {@code name="name"}; element names are lower case only.
     */
    XHTML,
}
