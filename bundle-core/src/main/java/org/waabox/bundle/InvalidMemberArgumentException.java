package org.waabox.bundle;

/**
 * Thrown when an argument given to {@link Catalog#add(Object...)} or
 * {@link Catalog#remove(Object...)} is of a type the catalog does not
 * accept.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InvalidMemberArgumentException
    extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception describing the rejected argument.
   *
   * @param operation the catalog operation, cannot be null.
   * @param accepted  a description of the accepted types, cannot be null.
   * @param argument  the rejected argument, may be null.
   */
  public InvalidMemberArgumentException(final String operation,
      final String accepted, final Object argument) {
    super("Invalid argument for " + operation + ": only " + accepted
        + " acceptable, got "
        + (argument == null ? "null" : argument.getClass().getName()));
  }
}
