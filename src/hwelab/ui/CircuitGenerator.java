package hwelab.ui;

import hwelab.elab.Builder;

/**
 * A circuit description that can be elaborated by name, e.g. from the command line.
 * Implementations need a public no-argument constructor.
 */
public interface CircuitGenerator {
  /** The circuit name. */
  String name();

  /** Declares the ports and logic of the circuit on the given (active) builder. */
  void build(Builder builder);
}
