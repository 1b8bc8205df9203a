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

/**
 * Immutable cursor referencing a single node of a {@linkplain StableList}: an item or one of the two sentinels.
 * Moving the cursor creates a new iterator. An iterator is valid until the node it references is removed or
 * the list is closed, insertions and removals of other nodes don't affect it. Once invalid, it never becomes
 * valid again, and all its methods except {@linkplain #isValid()}, {@linkplain #isEnd()},
 * {@linkplain #isHead()} and {@linkplain #getList()} fail with {@linkplain InvalidIteratorException}.
 *
 * <p>Two iterators are equal if they reference the same node of the same list.
 *
 * @param <T> type of items
 */
public interface StableIterator<T> {

    @NotNull
    StableList<T> getList();

    /**
     * @throws InvalidIteratorException if the iterator references a sentinel
     */
    T value();

    /**
     * @throws InvalidIteratorException if the iterator is {@linkplain StableList#end()}
     */
    @NotNull
    StableIterator<T> next();

    /**
     * @throws InvalidIteratorException if the iterator is {@linkplain StableList#rbegin()}
     */
    @NotNull
    StableIterator<T> previous();

    /**
     * Inserts items right after the referenced node in the given order.
     *
     * @throws InvalidIteratorException if the iterator is {@linkplain StableList#end()}
     */
    void insertAfter(@NotNull T... items);

    void insertAfter(@NotNull Iterable<? extends T> items);

    /**
     * Inserts items right before the referenced node in the given order.
     *
     * @throws InvalidIteratorException if the iterator is {@linkplain StableList#rbegin()}
     */
    void insertBefore(@NotNull T... items);

    void insertBefore(@NotNull Iterable<? extends T> items);

    /**
     * Same as {@code getList().erase(this)}.
     */
    @NotNull
    StableIterator<T> remove();

    boolean isValid();

    /**
     * @return {@code true} if the iterator references the sentinel after the last item
     */
    boolean isEnd();

    /**
     * @return {@code true} if the iterator references the sentinel before the first item
     */
    boolean isHead();
}
