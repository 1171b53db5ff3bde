package org.ggp.graphmcts.graph;

/**
 * Where an edge leads.  Immutable.
 *
 * An edge starts out {@link Kind#UNEXPANDED} and is resolved exactly once, to either {@link Kind#EXPANDED} or
 * {@link Kind#CYCLE}.
 */
public final class Target
{
  /**
   * The kinds of target.
   */
  public static enum Kind
  {
    /**
     * The edge's action has not yet been applied.
     */
    UNEXPANDED,

    /**
     * The edge leads to a vertex from which its source is not reachable.
     */
    EXPANDED,

    /**
     * The edge leads to a vertex from which its source is reachable, so following it closes a cycle.
     */
    CYCLE;
  }

  /**
   * The target of every edge that hasn't been resolved.
   */
  public static final Target UNEXPANDED = new Target(Kind.UNEXPANDED, -1);

  private final Kind mKind;
  private final int  mVertexId;

  private Target(Kind xiKind, int xiVertexId)
  {
    mKind = xiKind;
    mVertexId = xiVertexId;
  }

  /**
   * @return an expanded target.
   *
   * @param xiVertexId - id of the target vertex.
   */
  public static Target expanded(int xiVertexId)
  {
    return new Target(Kind.EXPANDED, xiVertexId);
  }

  /**
   * @return a cyclic target.
   *
   * @param xiVertexId - id of the target vertex.
   */
  public static Target cycle(int xiVertexId)
  {
    return new Target(Kind.CYCLE, xiVertexId);
  }

  public Kind getKind()
  {
    return mKind;
  }

  public boolean isUnexpanded()
  {
    return mKind == Kind.UNEXPANDED;
  }

  /**
   * @return the id of the target vertex.  Not valid for unexpanded targets.
   */
  public int getVertexId()
  {
    assert(mKind != Kind.UNEXPANDED) : "Unexpanded target has no vertex";
    return mVertexId;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof Target))
    {
      return false;
    }
    Target lOther = (Target)xiOther;
    return (mKind == lOther.mKind) && (mVertexId == lOther.mVertexId);
  }

  @Override
  public int hashCode()
  {
    return mKind.hashCode() * 31 + mVertexId;
  }

  @Override
  public String toString()
  {
    switch (mKind)
    {
      case EXPANDED: return "Expanded(" + mVertexId + ")";
      case CYCLE:    return "Cycle(" + mVertexId + ")";
      default:       return "Unexpanded";
    }
  }
}
