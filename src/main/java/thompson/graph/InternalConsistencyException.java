package thompson.graph;

/**
 * Postfix token stream whose shape can't be turned into an NFA.
 *
 * <p>Streams produced by {@link thompson.parser.PostfixConverter} never
 * trigger this, so seeing it means there is a bug upstream of the builder
 * rather than a problem with the pattern.
 */
public class InternalConsistencyException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = -4021785530128730611L;

  public InternalConsistencyException(String message) {
    super(message);
  }
}
