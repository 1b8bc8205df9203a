/**
 * Copyright 2010 - 2018 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package stablelist.list;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.util.List;

/**
 * Doubly linked list with stable iterators. A {@linkplain StableIterator} references a single node and stays
 * valid while other nodes are inserted or erased, so any element can be removed in constant time without
 * affecting iterators held elsewhere. The list is bounded by two sentinel nodes: {@linkplain #rbegin()}
 * references the one before the first item, {@linkplain #end()} the one after the last item.
 *
 * <p>To create a list, use {@code StableLists.newInstance(...)}:
 * <pre>
 *     final StableList&lt;String&gt; list = StableLists.newInstance("foo", "bar", "baz");
 *     list.begin().insertAfter("quz");
 *     list.erase(list.end().previous());
 * </pre>
 * After finishing working with the list you can {@linkplain #close()} it, which releases all nodes at once and
 * invalidates every iterator.
 *
 * <p>Instances are not thread-safe.
 *
 * @param <T> type of items
 * @see StableIterator
 */
public interface StableList<T> extends Iterable<T>, Closeable {

    /**
     * Appends items to the end of the list in the given order.
     */
    void pushBack(@NotNull T... items);

    void pushBack(@NotNull Iterable<? extends T> items);

    /**
     * Prepends items to the start of the list so that the first given item becomes the first item of the list.
     */
    void pushFront(@NotNull T... items);

    void pushFront(@NotNull Iterable<? extends T> items);

    /**
     * Removes the last item and returns it.
     *
     * @throws EmptyListException if the list is empty
     */
    T popBack();

    /**
     * Removes the first item and returns it.
     *
     * @throws EmptyListException if the list is empty
     */
    T popFront();

    /**
     * @throws EmptyListException if the list is empty
     */
    T front();

    /**
     * @throws EmptyListException if the list is empty
     */
    T back();

    /**
     * Runs in constant time.
     */
    boolean isEmpty();

    /**
     * Counts items by traversing the list, so runs in linear time.
     */
    int size();

    /**
     * @return new list containing the items in order, the list itself isn't changed
     */
    @NotNull
    List<T> toList();

    /**
     * @return iterator referencing the first item or {@linkplain #end()} if the list is empty
     */
    @NotNull
    StableIterator<T> begin();

    /**
     * @return iterator referencing the position after the last item, it is never dereferenceable
     */
    @NotNull
    StableIterator<T> end();

    /**
     * @return iterator referencing the position before the first item, it is never dereferenceable
     */
    @NotNull
    StableIterator<T> rbegin();

    /**
     * Removes the item referenced by the iterator. The iterator becomes invalid, all other iterators are
     * unaffected.
     *
     * @param it iterator referencing an item of this list
     * @return iterator referencing the node which followed the removed one, {@linkplain #end()} if the last item
     * was removed
     * @throws InvalidIteratorException if the iterator references a sentinel, belongs to another list or is no
     *                                  longer valid
     */
    @NotNull
    StableIterator<T> erase(@NotNull StableIterator<T> it);

    /**
     * Removes all items. Iterators referencing items become invalid, {@linkplain #begin()} becomes equal to
     * {@linkplain #end()}.
     */
    void clear();

    @NotNull
    StableListConfig getConfig();

    /**
     * Releases all nodes of the list and invalidates every iterator. Further calls of list methods fail with
     * {@linkplain ListClosedException}, methods of iterators fail with {@linkplain InvalidIteratorException}.
     * Closing a closed list does nothing.
     */
    @Override
    void close();

    /**
     * @return {@code false} if the instance is closed
     */
    boolean isOpen();
}
