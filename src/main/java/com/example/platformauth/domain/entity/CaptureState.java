package com.example.platformauth.domain.entity;

/**
 * Lifecycle of a single interactive login attempt.
 */
public enum CaptureState {
  IDLE,
  AWAITING_NAVIGATION,
  EVALUATING,
  SUCCEEDED,
  ABORTED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == ABORTED;
  }
}
