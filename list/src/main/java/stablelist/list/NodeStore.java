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

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Slot storage of list nodes. A node is an index into parallel arrays of items, links and generations, so
 * links between nodes are plain ints and there are no reference cycles to break. Slots {@linkplain #HEAD} and
 * {@linkplain #TAIL} are sentinels. Released slots are chained into a free list through {@code next} and
 * marked by {@linkplain #FREE} in {@code prev}.
 *
 * <p>Each slot has a generation which is incremented when the slot is released. A position recorded as
 * (slot, generation) is linked iff the slot isn't free and its generation hasn't changed since.
 */
final class NodeStore<T> {

    private static final Logger logger = LoggerFactory.getLogger(NodeStore.class);

    static final int HEAD = 0;
    static final int TAIL = 1;
    static final int NONE = -1;
    static final int FREE = -2;
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final int initialCapacity;
    private Object[] items;
    private int[] next;
    private int[] prev;
    private int[] generations;
    // slots [0, top) have been handed out at least once
    private int top;
    private int freeHead;
    // generation assigned to slots which have never been used
    private int freshGeneration;

    NodeStore(final int initialCapacity) {
        this.initialCapacity = Math.max(initialCapacity, StableListConfig.MIN_CAPACITY);
        allocate(this.initialCapacity);
        reset();
    }

    boolean isEmpty() {
        return next[HEAD] == TAIL;
    }

    int size() {
        int result = 0;
        for (int slot = next[HEAD]; slot != TAIL; slot = next[slot]) {
            ++result;
        }
        return result;
    }

    int getCapacity() {
        return items.length;
    }

    int first() {
        return next[HEAD];
    }

    int last() {
        return prev[TAIL];
    }

    int next(final int slot) {
        return next[slot];
    }

    int prev(final int slot) {
        return prev[slot];
    }

    @SuppressWarnings("unchecked")
    T item(final int slot) {
        return (T) items[slot];
    }

    int generation(final int slot) {
        return generations[slot];
    }

    static boolean isSentinel(final int slot) {
        return slot == HEAD || slot == TAIL;
    }

    boolean isLinked(final int slot, final int generation) {
        return slot >= 0 && slot < top && prev[slot] != FREE && generations[slot] == generation;
    }

    /**
     * Creates a node holding the item and links it right before the anchor node.
     *
     * @return slot of the new node
     */
    int insertBefore(final int anchor, @Nullable final T item) {
        final int slot = allocateSlot();
        items[slot] = item;
        final int p = prev[anchor];
        next[p] = slot;
        prev[slot] = p;
        next[slot] = anchor;
        prev[anchor] = slot;
        return slot;
    }

    int insertAfter(final int anchor, @Nullable final T item) {
        return insertBefore(next[anchor], item);
    }

    /**
     * Unlinks a value node and returns its slot to the free list.
     *
     * @return item the node held
     */
    T release(final int slot) {
        final int p = prev[slot];
        final int n = next[slot];
        next[p] = n;
        prev[n] = p;
        final T result = item(slot);
        free(slot);
        return result;
    }

    /**
     * Releases all value nodes walking from the head, sentinels stay linked to each other.
     *
     * @return number of released nodes
     */
    int clear() {
        int released = 0;
        int slot = next[HEAD];
        while (slot != TAIL) {
            final int n = next[slot];
            free(slot);
            slot = n;
            ++released;
        }
        next[HEAD] = TAIL;
        prev[TAIL] = HEAD;
        return released;
    }

    /**
     * Shrinks storage of an empty store back to initial capacity.
     */
    void trim() {
        if (!isEmpty()) {
            throw new IllegalStateException("Can't trim non-empty node store");
        }
        int maxGeneration = freshGeneration;
        for (int i = 0; i < top; ++i) {
            maxGeneration = Math.max(maxGeneration, generations[i]);
        }
        final int[] oldGenerations = generations;
        allocate(initialCapacity);
        System.arraycopy(oldGenerations, 0, generations, 0, Math.min(oldGenerations.length, initialCapacity));
        // slots beyond initial capacity can be handed out again, they must not match positions recorded before
        freshGeneration = maxGeneration + 1;
        Arrays.fill(generations, TAIL + 1, initialCapacity, freshGeneration);
        reset();
    }

    /**
     * Releases all nodes including sentinels, no position recorded before remains linked.
     */
    void dispose() {
        Arrays.fill(items, null);
        for (int i = 0; i < top; ++i) {
            ++generations[i];
            prev[i] = FREE;
        }
        top = 0;
        freeHead = NONE;
    }

    /**
     * Verifies that the chain from head to tail is mutually linked and accounts for all slots in use.
     *
     * @return description of the first violation found or {@code null} if the chain is consistent
     */
    @Nullable
    String checkConsistency() {
        final int maxNodes = top - 2;
        int forward = 0;
        for (int slot = HEAD; slot != TAIL; slot = next[slot]) {
            final int n = next[slot];
            if (n < 0 || n >= top || prev[n] == FREE) {
                return "slot " + slot + " links to unused slot " + n;
            }
            if (prev[n] != slot) {
                return "slot " + n + " doesn't link back to slot " + slot;
            }
            if (++forward > maxNodes + 1) {
                return "chain from head doesn't reach tail";
            }
        }
        int backward = 0;
        for (int slot = TAIL; slot != HEAD; slot = prev[slot]) {
            if (++backward > maxNodes + 1) {
                return "chain from tail doesn't reach head";
            }
        }
        if (forward != backward) {
            return "forward length " + forward + " differs from backward length " + backward;
        }
        int free = 0;
        for (int slot = freeHead; slot != NONE; slot = next[slot]) {
            if (prev[slot] != FREE || ++free > maxNodes) {
                return "free list is broken at slot " + slot;
            }
        }
        if (forward - 1 + free != maxNodes) {
            return (maxNodes - forward + 1 - free) + " slots are neither linked nor free";
        }
        return null;
    }

    private int allocateSlot() {
        final int slot = freeHead;
        if (slot != NONE) {
            freeHead = next[slot];
            return slot;
        }
        ensureCapacity(top + 1);
        return top++;
    }

    private void free(final int slot) {
        items[slot] = null;
        ++generations[slot];
        prev[slot] = FREE;
        next[slot] = freeHead;
        freeHead = slot;
    }

    private void ensureCapacity(final int minCapacity) {
        final int oldCapacity = items.length;
        if (minCapacity > oldCapacity) {
            final int newCapacity = grownCapacity(oldCapacity, minCapacity);
            items = Arrays.copyOf(items, newCapacity);
            next = Arrays.copyOf(next, newCapacity);
            prev = Arrays.copyOf(prev, newCapacity);
            generations = Arrays.copyOf(generations, newCapacity);
            Arrays.fill(generations, oldCapacity, newCapacity, freshGeneration);
            if (logger.isDebugEnabled()) {
                logger.debug("Node store grown from " + oldCapacity + " to " + newCapacity + " slots");
            }
        }
    }

    static int grownCapacity(final int oldCapacity, final int minCapacity) {
        final int newCapacity = (int) Math.min(((long) oldCapacity << 3) / 5 + 1, MAX_CAPACITY);
        return newCapacity < minCapacity ? minCapacity : newCapacity;
    }

    private void allocate(final int capacity) {
        items = new Object[capacity];
        next = new int[capacity];
        prev = new int[capacity];
        generations = new int[capacity];
        Arrays.fill(generations, freshGeneration);
    }

    private void reset() {
        next[HEAD] = TAIL;
        prev[HEAD] = NONE;
        next[TAIL] = NONE;
        prev[TAIL] = HEAD;
        top = TAIL + 1;
        freeHead = NONE;
    }
}
