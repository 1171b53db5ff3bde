package org.ggp.graphmcts.search;

/**
 * Identifies a search round.  Immutable.
 *
 * The epoch advances whenever the search state moves on (a new round, or a new root), so that log output and
 * failures can be tied to the round that produced them.
 */
public final class Epoch
{
  /**
   * The epoch of a newly created search.
   */
  public static final Epoch INITIAL = new Epoch(0);

  private final long mValue;

  private Epoch(long xiValue)
  {
    mValue = xiValue;
  }

  /**
   * @return the epoch after this one.
   */
  public Epoch next()
  {
    return new Epoch(mValue + 1);
  }

  public long getValue()
  {
    return mValue;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof Epoch) && (((Epoch)xiOther).mValue == mValue);
  }

  @Override
  public int hashCode()
  {
    return Long.hashCode(mValue);
  }

  @Override
  public String toString()
  {
    return "epoch " + mValue;
  }
}
