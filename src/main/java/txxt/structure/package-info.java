// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Classification of the block group tree into sessions, content containers, lists and plain elements.
 * <p>
 * {@link txxt.structure.SessionDisambiguator} is the entry point; {@link txxt.structure.Annotations} exposes the
 * annotation token ranges for attachment by a later phase.
 */
@NonNullByDefault
package txxt.structure;

import txxt.util.annotation.NonNullByDefault;
