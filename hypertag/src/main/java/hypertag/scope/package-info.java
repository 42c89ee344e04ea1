// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Name scoping at analysis time and value stacks at expansion time.
 * <p>
 * {@link hypertag.scope.ScopeStack} resolves names while a template is analyzed. When it's expanded, values live in
 * {@link hypertag.scope.Frame frames} on a {@link hypertag.scope.ValueStack}; a {@link hypertag.scope.Closure}
 * freezes a prefix of that stack through a {@link hypertag.scope.StackBranch}, so that a hypertag passed around as a
 * value still sees the variables of the place it was taken from.
 */
package hypertag.scope;
