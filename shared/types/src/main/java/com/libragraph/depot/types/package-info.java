/**
 * Pure Java value types shared across all Depot modules.
 *
 * <p>Resource names ({@link com.libragraph.depot.types.Prn}), resource types and the
 * binary lifecycle ({@link com.libragraph.depot.types.BinaryState}).
 * This module has no framework dependencies.
 */
package com.libragraph.depot.types;
