package com.streamfirst.shush.application;

/** What the user asked to do with the resolved targets. */
public enum PlanAction {
  SILENCE,
  CLEAR,
  LIST
}
