package org.ggp.graphmcts.search.policy;

import org.ggp.graphmcts.search.exceptions.SelectorException;

/**
 * UCB1 scoring failed.
 */
@SuppressWarnings("serial")
public class UcbException extends SelectorException
{
  /**
   * The ways UCB1 scoring can fail.
   */
  public static enum Kind
  {
    /**
     * The vertex has no children to choose between.
     */
    NO_CHILDREN,

    /**
     * A score couldn't be compared (NaN).
     */
    INVALID_COMPUTATION;
  }

  private final Kind mKind;

  public UcbException(Kind xiKind, String xiMessage)
  {
    super(xiMessage);
    mKind = xiKind;
  }

  public Kind getKind()
  {
    return mKind;
  }
}
