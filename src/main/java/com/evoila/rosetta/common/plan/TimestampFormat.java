package com.evoila.rosetta.common.plan;

public enum TimestampFormat {
  UNIX_MS,
  UNIX_NS,
  UNIX_US,
  UNIX_S,
  RFC3339,
  ISO8601
}
