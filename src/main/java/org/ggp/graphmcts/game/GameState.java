package org.ggp.graphmcts.game;

/**
 * A complete decision point in a game.
 *
 * The search graph uses states as keys in its transposition table, so implementations must give equals() and
 * hashCode() value semantics.  A state must not be mutated once it has been handed to the graph - the engine only
 * ever calls doAction() on copies.
 *
 * @param <S> - the concrete state type.
 * @param <A> - the action type.
 */
public interface GameState<S extends GameState<S, A>, A>
{
  /**
   * @return the index of the player to move in this state.
   */
  public int getActivePlayer();

  /**
   * Enumerate the legal actions from this state.
   *
   * @param xiVisitor - visitor to call for each action.  Enumeration stops early if the visitor returns false.
   */
  public void forEachAction(ActionVisitor<A> xiVisitor);

  /**
   * Apply an action to this state, in place.
   *
   * @param xiAction - the action, which must be legal in this state.
   */
  public void doAction(A xiAction);

  /**
   * @return an independent copy of this state.
   */
  public S copy();
}
