package hwelab.elab;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Signals a malformed circuit description.
 * Carries either the single error that aborted elaboration or all errors collected up to the abort.
 */
public class ElaborationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final List<ElabError> errors;

  public ElaborationException(ErrorKind kind, String message) { this(List.of(new ElabError(kind, message))); }

  public ElaborationException(List<ElabError> errors) {
    super(errors.size() == 1 ? errors.get(0).toString()
                             : errors.size() + " elaboration errors:\n" +
                                   errors.stream().map(err -> "  " + err).collect(Collectors.joining("\n")));
    if (errors.isEmpty())
      throw new IllegalArgumentException("errors must not be empty");
    this.errors = List.copyOf(errors);
  }

  /** @return the kind of the first error */
  public ErrorKind getKind() { return errors.get(0).getKind(); }

  public List<ElabError> getErrors() { return errors; }
}
