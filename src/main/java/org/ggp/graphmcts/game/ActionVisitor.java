package org.ggp.graphmcts.game;

/**
 * Callback for enumerating the legal actions from a state.
 *
 * @param <A> - the action type.
 */
public interface ActionVisitor<A>
{
  /**
   * Process a single legal action.
   *
   * @param xiAction - the action.
   *
   * @return true to continue enumerating, false to stop.
   */
  public boolean visit(A xiAction);
}
