// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the whole engine: user-readable operation traces and checked exception helpers.
 */
package hypertag.util;
