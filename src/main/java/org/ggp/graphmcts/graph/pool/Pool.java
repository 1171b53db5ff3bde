package org.ggp.graphmcts.graph.pool;


/**
 * A pool of items addressed by a small integer index.
 *
 * @param <ItemType> - the type of items stored in this pool.
 */
public interface Pool<ItemType>
{
  /**
   * Interface to be implemented by classes capable of allocating (and resetting) objects in a pool.
   *
   * @param <ItemType> the type of item to be allocated.
   */
  public interface ObjectAllocator<ItemType>
  {
    /**
     * @return a newly allocated object.
     *
     * @param xiPoolIndex - index in the pool from which this object was allocated.
     */
    public ItemType newObject(int xiPoolIndex);

    /**
     * Reset an object, ready for re-use.
     *
     * @param xiObject - the object to reset.
     * @param xiFree   - whether the object is being freed (rather than re-allocated).
     */
    public void resetObject(ItemType xiObject, boolean xiFree);
  }

  /**
   * Allocate a new item from the pool.
   *
   * @param xiAllocator - object allocator to use if no freed items are available.
   *
   * @return the new item.
   */
  public ItemType allocate(ObjectAllocator<ItemType> xiAllocator);

  /**
   * Return an item to the pool.
   *
   * The pool promises to call resetObject() for any freed items before re-use.
   *
   * @param xiAllocator - the allocator that created the item.
   * @param xiIndex     - index of the item being freed.
   */
  public void free(ObjectAllocator<ItemType> xiAllocator, int xiIndex);

  /**
   * Free every allocated item.
   *
   * @param xiAllocator - the allocator that created the items.
   */
  public void clear(ObjectAllocator<ItemType> xiAllocator);

  /**
   * @return the item at the specified index, which must be allocated.
   *
   * @param xiIndex - the index.
   */
  public ItemType get(int xiIndex);

  /**
   * @return whether the item at the specified index is currently allocated.
   *
   * @param xiIndex - the index.
   */
  public boolean isAllocated(int xiIndex);

  /**
   * @return one more than the largest index ever allocated.  Every allocated index is below this.
   */
  public int getHighWaterMark();

  /**
   * @return the number of items currently in use.
   */
  public int getNumItemsInUse();
}
