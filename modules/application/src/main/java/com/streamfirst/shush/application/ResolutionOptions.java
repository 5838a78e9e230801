package com.streamfirst.shush.application;

/**
 * How selectors are checked against the inventory.
 *
 * @param strict an empty expansion fails resolution instead of being skipped with a warning
 * @param verifyExact exact client and subscription names must also appear in the inventory
 */
public record ResolutionOptions(boolean strict, boolean verifyExact) {

  public static final ResolutionOptions LENIENT = new ResolutionOptions(false, false);
  public static final ResolutionOptions STRICT = new ResolutionOptions(true, false);
}
