package io.cronconv.eval;

/** The direction in which a schedule is searched. */
public enum Direction {
  /** Step forward and truncate to the start of each unit. */
  FORWARD,
  /** Step backward and truncate to the end of each unit. */
  BACKWARD
}
