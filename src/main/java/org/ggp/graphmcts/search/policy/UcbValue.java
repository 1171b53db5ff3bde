package org.ggp.graphmcts.search.policy;

/**
 * The UCB1 assessment of one edge, for reporting.
 */
public final class UcbValue
{
  /**
   * The kinds of assessment.
   */
  public static enum Kind
  {
    /**
     * The edge is unvisited, so would be selected outright.
     */
    SELECT,

    /**
     * The edge has a UCB1 score.
     */
    VALUE,

    /**
     * The edge couldn't be scored.
     */
    INVALID;
  }

  private static final UcbValue SELECT_VALUE = new UcbValue(Kind.SELECT, Double.NaN, null);

  private final Kind         mKind;
  private final double       mValue;
  private final UcbException mError;

  private UcbValue(Kind xiKind, double xiValue, UcbException xiError)
  {
    mKind = xiKind;
    mValue = xiValue;
    mError = xiError;
  }

  public static UcbValue select()
  {
    return SELECT_VALUE;
  }

  public static UcbValue value(double xiValue)
  {
    return new UcbValue(Kind.VALUE, xiValue, null);
  }

  public static UcbValue invalid(UcbException xiError)
  {
    return new UcbValue(Kind.INVALID, Double.NaN, xiError);
  }

  public Kind getKind()
  {
    return mKind;
  }

  /**
   * @return the score.  Only meaningful for {@link Kind#VALUE}.
   */
  public double getValue()
  {
    return mValue;
  }

  /**
   * @return the failure.  Only set for {@link Kind#INVALID}.
   */
  public UcbException getError()
  {
    return mError;
  }

  @Override
  public String toString()
  {
    switch (mKind)
    {
      case SELECT: return "Select";
      case VALUE:  return String.format("%.4f", mValue);
      default:     return "Invalid(" + mError.getMessage() + ")";
    }
  }
}
