// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The environment a template is translated against: the modules it can import from and the output escaping.
 */
package hypertag.runtime;
