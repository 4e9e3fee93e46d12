package com.scholary.audiobook.handler.planning;

/** The source file set cannot be planned: duplicate indices, negative sizes or durations. */
public class InvalidSourceSetException extends PlanningException {

  public InvalidSourceSetException(String message) {
    super(message);
  }
}
