package com.streamfirst.shush.application;

/**
 * What to do when a target is already silenced with a different reason or expiration.
 */
public enum ConflictPolicy {
  /** Report the target as failed with a conflict */
  FAIL,
  /** Replace the existing silence */
  OVERWRITE,
  /** Leave the existing silence alone and report the target as skipped */
  SKIP
}
