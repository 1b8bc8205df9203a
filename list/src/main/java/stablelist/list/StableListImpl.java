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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stablelist.StableListException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static stablelist.list.NodeStore.HEAD;
import static stablelist.list.NodeStore.TAIL;

public class StableListImpl<T> implements StableList<T> {

    private static final Logger logger = LoggerFactory.getLogger(StableListImpl.class);

    @NotNull
    private final StableListConfig config;
    @NotNull
    private final NodeStore<T> store;
    private final boolean checkChainConsistency;
    private final boolean trimOnClear;
    private boolean isOpen;

    StableListImpl(@NotNull final StableListConfig config) {
        this.config = config;
        store = new NodeStore<>(config.getInitialCapacity());
        checkChainConsistency = config.isCheckChainConsistency();
        trimOnClear = config.isTrimOnClear();
        isOpen = true;
        loggerDebug("Created list with capacity of " + store.getCapacity() + " nodes");
    }

    @Override
    public void pushBack(@NotNull final T... items) {
        pushBack(Arrays.asList(items));
    }

    @Override
    public void pushBack(@NotNull final Iterable<? extends T> items) {
        checkIsOpen();
        for (final T item : snapshot(items)) {
            store.insertBefore(TAIL, item);
        }
        afterModification();
    }

    @Override
    public void pushFront(@NotNull final T... items) {
        pushFront(Arrays.asList(items));
    }

    @Override
    public void pushFront(@NotNull final Iterable<? extends T> items) {
        checkIsOpen();
        final List<? extends T> snapshot = snapshot(items);
        // inserting each item before the former first node keeps the given order
        final int first = store.first();
        for (final T item : snapshot) {
            store.insertBefore(first, item);
        }
        afterModification();
    }

    @Override
    public T popBack() {
        checkIsOpen();
        if (store.isEmpty()) {
            throw new EmptyListException("No items to pop from the list");
        }
        final T result = store.release(store.last());
        afterModification();
        return result;
    }

    @Override
    public T popFront() {
        checkIsOpen();
        if (store.isEmpty()) {
            throw new EmptyListException("No items to shift from the list");
        }
        final T result = store.release(store.first());
        afterModification();
        return result;
    }

    @Override
    public T front() {
        checkIsOpen();
        if (store.isEmpty()) {
            throw new EmptyListException("No front item in the empty list");
        }
        return store.item(store.first());
    }

    @Override
    public T back() {
        checkIsOpen();
        if (store.isEmpty()) {
            throw new EmptyListException("No back item in the empty list");
        }
        return store.item(store.last());
    }

    @Override
    public boolean isEmpty() {
        checkIsOpen();
        return store.isEmpty();
    }

    @Override
    public int size() {
        checkIsOpen();
        return store.size();
    }

    @NotNull
    @Override
    public List<T> toList() {
        checkIsOpen();
        final List<T> result = new ArrayList<>();
        for (int slot = store.first(); slot != TAIL; slot = store.next(slot)) {
            result.add(store.item(slot));
        }
        return result;
    }

    @NotNull
    @Override
    public Iterator<T> iterator() {
        return new ItemIterator();
    }

    @NotNull
    @Override
    public StableIterator<T> begin() {
        checkIsOpen();
        return iteratorAt(store.first());
    }

    @NotNull
    @Override
    public StableIterator<T> end() {
        checkIsOpen();
        return iteratorAt(TAIL);
    }

    @NotNull
    @Override
    public StableIterator<T> rbegin() {
        checkIsOpen();
        return iteratorAt(HEAD);
    }

    @NotNull
    @Override
    public StableIterator<T> erase(@NotNull final StableIterator<T> it) {
        checkIsOpen();
        final int slot = checkOwnIterator(it).getSlot();
        if (NodeStore.isSentinel(slot)) {
            throw new InvalidIteratorException(slot == TAIL ?
                "Can't erase the end of the list" : "Can't erase the head of the list");
        }
        final int next = store.next(slot);
        store.release(slot);
        afterModification();
        return iteratorAt(next);
    }

    @Override
    public void clear() {
        checkIsOpen();
        final int released = store.clear();
        if (trimOnClear) {
            store.trim();
        }
        afterModification();
        loggerDebug("Cleared list, released " + released + " nodes");
    }

    @NotNull
    @Override
    public StableListConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (!isOpen) {
            return;
        }
        final int released = store.clear();
        store.dispose();
        isOpen = false;
        loggerDebug("Closed list, released " + released + " nodes");
    }

    @Override
    public boolean isOpen() {
        return isOpen;
    }

    @Override
    public String toString() {
        return isOpen ? toList().toString() : "[closed]";
    }

    @NotNull
    StableIteratorImpl<T> iteratorAt(final int slot) {
        return new StableIteratorImpl<>(this, slot, store.generation(slot));
    }

    boolean isLinked(final int slot, final int generation) {
        return isOpen && store.isLinked(slot, generation);
    }

    int nextSlot(final int slot) {
        return store.next(slot);
    }

    int prevSlot(final int slot) {
        return store.prev(slot);
    }

    T item(final int slot) {
        return store.item(slot);
    }

    void insertAfter(final int slot, @NotNull final Iterable<? extends T> items) {
        int anchor = slot;
        for (final T item : snapshot(items)) {
            anchor = store.insertAfter(anchor, item);
        }
        afterModification();
    }

    void insertBefore(final int slot, @NotNull final Iterable<? extends T> items) {
        for (final T item : snapshot(items)) {
            store.insertBefore(slot, item);
        }
        afterModification();
    }

    /**
     * Copies items before any node is linked, the source may be this very list.
     */
    private static <T> List<? extends T> snapshot(@NotNull final Iterable<? extends T> items) {
        if (items instanceof Collection) {
            return new ArrayList<>((Collection<? extends T>) items);
        }
        final List<T> result = new ArrayList<>();
        for (final T item : items) {
            result.add(item);
        }
        return result;
    }

    private StableIteratorImpl<T> checkOwnIterator(@NotNull final StableIterator<T> it) {
        if (!(it instanceof StableIteratorImpl) || it.getList() != this) {
            throw new InvalidIteratorException("Iterator doesn't belong to the list");
        }
        final StableIteratorImpl<T> result = (StableIteratorImpl<T>) it;
        result.checkIsValid();
        return result;
    }

    private void checkIsOpen() {
        if (!isOpen) {
            throw new ListClosedException();
        }
    }

    private void afterModification() {
        if (checkChainConsistency) {
            final String violation = store.checkConsistency();
            if (violation != null) {
                final String message = "Inconsistent chain of list nodes: " + violation;
                loggerError(message);
                throw new StableListException(message);
            }
        }
    }

    static void loggerError(@NotNull final String errorMessage) {
        logger.error(errorMessage);
    }

    static void loggerDebug(@NotNull final String message) {
        if (logger.isDebugEnabled()) {
            logger.debug(message);
        }
    }

    private final class ItemIterator implements Iterator<T> {

        private StableIterator<T> current = begin();
        @Nullable
        private StableIterator<T> last;

        @Override
        public boolean hasNext() {
            return !current.isEnd();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final T result = current.value();
            last = current;
            current = current.next();
            return result;
        }

        @Override
        public void remove() {
            if (last == null) {
                throw new IllegalStateException();
            }
            erase(last);
            last = null;
        }
    }
}
