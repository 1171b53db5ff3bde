package org.ggp.graphmcts.search.exceptions;

/**
 * Base class for recoverable search failures.
 */
@SuppressWarnings("serial")
public class SearchException extends Exception
{
  public SearchException(String xiMessage)
  {
    super(xiMessage);
  }

  public SearchException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
