package hwelab.elab;

/** A single reported elaboration error. */
public class ElabError {
  private final ErrorKind kind;
  private final String message;

  public ElabError(ErrorKind kind, String message) {
    this.kind = kind;
    this.message = message;
  }

  public ErrorKind getKind() { return kind; }
  public String getMessage() { return message; }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
