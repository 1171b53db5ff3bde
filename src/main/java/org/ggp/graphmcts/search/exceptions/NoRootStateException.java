package org.ggp.graphmcts.search.exceptions;

/**
 * The root state for a search isn't in the graph.  The caller must initialize the graph with the state first.
 */
@SuppressWarnings("serial")
public class NoRootStateException extends SearchException
{
  public NoRootStateException()
  {
    super("Root state is not in the search graph - initialize it first");
  }
}
