package org.ggp.graphmcts.game.twoplayer;

/**
 * The players of a two-player game.
 */
public enum Player
{
  ONE(0),
  TWO(1);

  private final int mIndex;

  private Player(int xiIndex)
  {
    mIndex = xiIndex;
  }

  /**
   * @return the player index, as used by GameState.getActivePlayer().
   */
  public int getIndex()
  {
    return mIndex;
  }

  /**
   * @return the other player.
   */
  public Player getOpponent()
  {
    return (this == ONE) ? TWO : ONE;
  }

  /**
   * @return the player with the specified index.
   *
   * @param xiIndex - the player index (0 or 1).
   */
  public static Player fromIndex(int xiIndex)
  {
    switch (xiIndex)
    {
      case 0: return ONE;
      case 1: return TWO;
      default: throw new IllegalArgumentException("Not a two-player index: " + xiIndex);
    }
  }
}
