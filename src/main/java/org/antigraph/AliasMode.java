package org.antigraph;

/**
 * How an included pixel must be corroborated by its alias-radius neighborhood to survive.
 */
public enum AliasMode {
  /** At least one other in-bounds pixel within the radius is also included. */
  CORROBORATE,

  /** Every in-bounds pixel within the radius is also included. */
  STRICT
}
