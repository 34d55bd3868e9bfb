package com.example.squad_announcer.model;

import java.util.Locale;

public enum DropReason {
  NOT_REGISTERED,
  NOT_FOUND,
  MODE_EXCLUDED,
  RATE_LIMITED,
  UNAVAILABLE,
  NOT_IN_MATCH;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
