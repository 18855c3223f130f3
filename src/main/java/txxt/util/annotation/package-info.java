// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Nullness qualifiers built on the JSR 305 meta-annotations.
 */
package txxt.util.annotation;
