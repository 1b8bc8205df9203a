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

import java.util.Arrays;

import static stablelist.list.NodeStore.HEAD;
import static stablelist.list.NodeStore.TAIL;

final class StableIteratorImpl<T> implements StableIterator<T> {

    @NotNull
    private final StableListImpl<T> list;
    private final int slot;
    private final int generation;

    StableIteratorImpl(@NotNull final StableListImpl<T> list, final int slot, final int generation) {
        this.list = list;
        this.slot = slot;
        this.generation = generation;
    }

    @NotNull
    @Override
    public StableList<T> getList() {
        return list;
    }

    @Override
    public T value() {
        checkIsValid();
        if (slot == TAIL) {
            throw new InvalidIteratorException("Can't get value at the end of the list");
        }
        if (slot == HEAD) {
            throw new InvalidIteratorException("Can't get value at the head of the list");
        }
        return list.item(slot);
    }

    @NotNull
    @Override
    public StableIterator<T> next() {
        checkIsValid();
        if (slot == TAIL) {
            throw new InvalidIteratorException("Can't move past the end of the list");
        }
        return list.iteratorAt(list.nextSlot(slot));
    }

    @NotNull
    @Override
    public StableIterator<T> previous() {
        checkIsValid();
        if (slot == HEAD) {
            throw new InvalidIteratorException("Can't move before the head of the list");
        }
        return list.iteratorAt(list.prevSlot(slot));
    }

    @Override
    public void insertAfter(@NotNull final T... items) {
        insertAfter(Arrays.asList(items));
    }

    @Override
    public void insertAfter(@NotNull final Iterable<? extends T> items) {
        checkIsValid();
        if (slot == TAIL) {
            throw new InvalidIteratorException("Can't insert after the end of the list");
        }
        list.insertAfter(slot, items);
    }

    @Override
    public void insertBefore(@NotNull final T... items) {
        insertBefore(Arrays.asList(items));
    }

    @Override
    public void insertBefore(@NotNull final Iterable<? extends T> items) {
        checkIsValid();
        if (slot == HEAD) {
            throw new InvalidIteratorException("Can't insert before the head of the list");
        }
        list.insertBefore(slot, items);
    }

    @NotNull
    @Override
    public StableIterator<T> remove() {
        checkIsValid();
        return list.erase(this);
    }

    @Override
    public boolean isValid() {
        return list.isLinked(slot, generation);
    }

    @Override
    public boolean isEnd() {
        return slot == TAIL && isValid();
    }

    @Override
    public boolean isHead() {
        return slot == HEAD && isValid();
    }

    int getSlot() {
        return slot;
    }

    void checkIsValid() {
        if (!list.isOpen()) {
            throw new InvalidIteratorException("Iterator of closed list", new ListClosedException());
        }
        if (!list.isLinked(slot, generation)) {
            throw new InvalidIteratorException("Iterator is no longer valid, its node was erased");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StableIteratorImpl)) return false;
        final StableIteratorImpl<?> that = (StableIteratorImpl<?>) o;
        return list == that.list && slot == that.slot && generation == that.generation;
    }

    @Override
    public int hashCode() {
        return (System.identityHashCode(list) * 31 + slot) * 31 + generation;
    }

    @Override
    public String toString() {
        if (slot == TAIL) {
            return "StableIterator[end]";
        }
        if (slot == HEAD) {
            return "StableIterator[head]";
        }
        return isValid() ? "StableIterator[" + list.item(slot) + ']' : "StableIterator[invalid]";
    }
}
