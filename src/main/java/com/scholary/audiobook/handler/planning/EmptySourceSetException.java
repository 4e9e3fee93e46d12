package com.scholary.audiobook.handler.planning;

/** No source files were supplied. An empty plan is never produced. */
public class EmptySourceSetException extends InvalidSourceSetException {

  public EmptySourceSetException() {
    super("No source files to plan");
  }
}
