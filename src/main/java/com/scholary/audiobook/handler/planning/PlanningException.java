package com.scholary.audiobook.handler.planning;

/**
 * Base class for failures that abort a planning run.
 *
 * <p>A planning failure means nothing gets written to the catalog: the caller has to fix the input
 * (or re-encode the offending file) and run again.
 */
public abstract class PlanningException extends RuntimeException {

  protected PlanningException(String message) {
    super(message);
  }
}
