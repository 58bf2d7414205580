package io.intellixity.sqlbuilder.args;

/**
 * Raised when a template references a placeholder token that was never registered.
 * <p>
 * Signals a bug in the builder that produced the template, not bad caller input.
 */
public final class ArgsCompileException extends IllegalStateException {
  public ArgsCompileException(String message) {
    super(message);
  }

  public ArgsCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
