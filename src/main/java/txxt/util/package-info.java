// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by every stage of the pipeline.
 */
@NonNullByDefault
package txxt.util;

import txxt.util.annotation.NonNullByDefault;
