/**
 * Shared utilities for all Revisions modules.
 *
 * <p>Contains {@link com.libragraph.revisions.util.ContentHash} (BLAKE3-256),
 * {@link com.libragraph.revisions.util.SemanticVersion} and the blob key convention in
 * {@link com.libragraph.revisions.util.StorageKeys}. No framework dependencies.
 */
package com.libragraph.revisions.util;
