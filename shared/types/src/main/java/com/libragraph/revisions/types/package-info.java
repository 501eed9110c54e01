/**
 * Pure Java value types shared across all Revisions modules.
 *
 * <p>The document payload model ({@link com.libragraph.revisions.types.DocumentContent},
 * {@link com.libragraph.revisions.types.Section}) lives here so that the blob codec, the
 * diff engine and the REST layer agree on one shape. No framework dependencies beyond
 * Jackson annotations.
 */
package com.libragraph.revisions.types;
