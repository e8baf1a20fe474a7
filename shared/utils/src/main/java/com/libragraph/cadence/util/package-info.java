/**
 * Shared utilities for all Cadence modules.
 *
 * <p>Contains {@link com.libragraph.cadence.util.UtcTimestamps}, the single place where
 * externally supplied timestamps are parsed and normalized to UTC before any comparison.
 * No framework dependencies.
 */
package com.libragraph.cadence.util;
