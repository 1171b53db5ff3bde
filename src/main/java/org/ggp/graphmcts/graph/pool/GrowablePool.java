package org.ggp.graphmcts.graph.pool;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gnu.trove.list.array.TIntArrayList;

/**
 * An indexed pool that grows as required.
 *
 * Freed items keep their index and are re-used (LIFO) before any new item is created, so the indices of items that
 * are never freed are stable for the life of the pool.
 *
 * Not thread-safe.  Callers serialize allocate() / free() / clear() against each other and against get().
 *
 * @param <ItemType> the type of item to be kept in the pool.
 */
public class GrowablePool<ItemType> implements Pool<ItemType>
{
  private static final Logger LOGGER = LogManager.getLogger();

  // The pool of items, indexed by pool index.
  private ItemType[]                                   mItems;
  private boolean[]                                    mAllocated;

  // Indices of items that are available for re-use.
  private final TIntArrayList                          mFreeIndices = new TIntArrayList();

  // Array index one beyond the largest allocated item.
  private int                                          mHighWaterMark = 0;

  // The number of items currently is use.
  private int                                          mNumItemsInUse = 0;

  /**
   * Create a pool.
   *
   * @param xiInitialCapacity - the number of items to allow for before growing.
   */
  @SuppressWarnings("unchecked")
  public GrowablePool(int xiInitialCapacity)
  {
    int lCapacity = Math.max(xiInitialCapacity, 16);
    mItems = (ItemType[])(new Object[lCapacity]);
    mAllocated = new boolean[lCapacity];
  }

  @Override
  public ItemType allocate(ObjectAllocator<ItemType> xiAllocator)
  {
    ItemType lAllocatedItem;

    if (!mFreeIndices.isEmpty())
    {
      // Re-use the most recently freed item.
      int lIndex = mFreeIndices.removeAt(mFreeIndices.size() - 1);
      lAllocatedItem = mItems[lIndex];
      xiAllocator.resetObject(lAllocatedItem, false);
      mAllocated[lIndex] = true;
    }
    else
    {
      if (mHighWaterMark == mItems.length)
      {
        int lNewCapacity = mItems.length * 2;
        LOGGER.debug("Growing pool from " + mItems.length + " to " + lNewCapacity + " items");
        mItems = Arrays.copyOf(mItems, lNewCapacity);
        mAllocated = Arrays.copyOf(mAllocated, lNewCapacity);
      }

      lAllocatedItem = xiAllocator.newObject(mHighWaterMark);
      mItems[mHighWaterMark] = lAllocatedItem;
      mAllocated[mHighWaterMark] = true;
      mHighWaterMark++;
    }

    mNumItemsInUse++;
    return lAllocatedItem;
  }

  @Override
  public void free(ObjectAllocator<ItemType> xiAllocator, int xiIndex)
  {
    assert(isAllocated(xiIndex)) : "Freeing unallocated pool item " + xiIndex;
    xiAllocator.resetObject(mItems[xiIndex], true);
    mAllocated[xiIndex] = false;
    mFreeIndices.add(xiIndex);
    mNumItemsInUse--;
  }

  @Override
  public void clear(ObjectAllocator<ItemType> xiAllocator)
  {
    for (int lii = 0; lii < mHighWaterMark; lii++)
    {
      if (mAllocated[lii])
      {
        free(xiAllocator, lii);
      }
    }
    assert(mNumItemsInUse == 0);
  }

  @Override
  public ItemType get(int xiIndex)
  {
    assert(isAllocated(xiIndex)) : "Access to unallocated pool item " + xiIndex;
    return mItems[xiIndex];
  }

  @Override
  public boolean isAllocated(int xiIndex)
  {
    return (xiIndex >= 0) && (xiIndex < mHighWaterMark) && mAllocated[xiIndex];
  }

  @Override
  public int getHighWaterMark()
  {
    return mHighWaterMark;
  }

  @Override
  public int getNumItemsInUse()
  {
    return mNumItemsInUse;
  }
}
