package org.ggp.graphmcts.search.exceptions;

/**
 * A pluggable selection, backprop or simulation strategy failed.  The current round is abandoned but the graph
 * remains valid and the search can be resumed.
 */
@SuppressWarnings("serial")
public class SelectorException extends SearchException
{
  public SelectorException(String xiMessage)
  {
    super(xiMessage);
  }

  public SelectorException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
