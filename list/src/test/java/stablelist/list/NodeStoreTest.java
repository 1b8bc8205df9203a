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

import org.junit.Assert;
import org.junit.Test;

import java.lang.reflect.Field;

import static stablelist.list.NodeStore.HEAD;
import static stablelist.list.NodeStore.TAIL;

public class NodeStoreTest {

    @Test
    public void empty() {
        final NodeStore<String> store = new NodeStore<>(4);
        Assert.assertTrue(store.isEmpty());
        Assert.assertEquals(0, store.size());
        Assert.assertEquals(TAIL, store.first());
        Assert.assertEquals(HEAD, store.last());
        Assert.assertTrue(store.isLinked(HEAD, store.generation(HEAD)));
        Assert.assertTrue(store.isLinked(TAIL, store.generation(TAIL)));
        Assert.assertNull(store.checkConsistency());
    }

    @Test
    public void capacityIsAtLeastSentinels() {
        Assert.assertEquals(2, new NodeStore<String>(0).getCapacity());
    }

    @Test
    public void growth() {
        final NodeStore<Integer> store = new NodeStore<>(2);
        for (int i = 0; i < 1000; ++i) {
            store.insertBefore(TAIL, i);
        }
        Assert.assertEquals(1000, store.size());
        Assert.assertTrue(store.getCapacity() >= 1002);
        int i = 0;
        for (int slot = store.first(); slot != TAIL; slot = store.next(slot)) {
            Assert.assertEquals(i++, store.item(slot).intValue());
        }
        i = 1000;
        for (int slot = store.last(); slot != HEAD; slot = store.prev(slot)) {
            Assert.assertEquals(--i, store.item(slot).intValue());
        }
        Assert.assertNull(store.checkConsistency());
    }

    @Test
    public void insertAfter() {
        final NodeStore<String> store = new NodeStore<>(4);
        final int a = store.insertAfter(HEAD, "a");
        store.insertAfter(a, "c");
        store.insertAfter(a, "b");
        Assert.assertEquals("a", store.item(store.first()));
        Assert.assertEquals("b", store.item(store.next(store.first())));
        Assert.assertEquals("c", store.item(store.last()));
        Assert.assertNull(store.checkConsistency());
    }

    @Test
    public void releasedSlotIsReused() {
        final NodeStore<String> store = new NodeStore<>(8);
        final int a = store.insertBefore(TAIL, "a");
        final int generation = store.generation(a);
        Assert.assertTrue(store.isLinked(a, generation));
        Assert.assertEquals("a", store.release(a));
        Assert.assertFalse(store.isLinked(a, generation));
        Assert.assertTrue(store.isEmpty());
        final int b = store.insertBefore(TAIL, "b");
        Assert.assertEquals(a, b);
        Assert.assertFalse(store.isLinked(b, generation));
        Assert.assertTrue(store.isLinked(b, store.generation(b)));
        Assert.assertNull(store.checkConsistency());
    }

    @Test
    public void clearKeepsSentinels() {
        final NodeStore<Integer> store = new NodeStore<>(4);
        final int headGeneration = store.generation(HEAD);
        final int tailGeneration = store.generation(TAIL);
        final int[] slots = new int[10];
        for (int i = 0; i < slots.length; ++i) {
            slots[i] = store.insertBefore(TAIL, i);
        }
        Assert.assertEquals(10, store.clear());
        Assert.assertTrue(store.isEmpty());
        Assert.assertTrue(store.isLinked(HEAD, headGeneration));
        Assert.assertTrue(store.isLinked(TAIL, tailGeneration));
        for (final int slot : slots) {
            Assert.assertFalse(store.isLinked(slot, 0));
        }
        Assert.assertNull(store.checkConsistency());
    }

    @Test
    public void trim() {
        final NodeStore<Integer> store = new NodeStore<>(4);
        final int[] slots = new int[100];
        final int[] generations = new int[100];
        for (int i = 0; i < slots.length; ++i) {
            slots[i] = store.insertBefore(TAIL, i);
            generations[i] = store.generation(slots[i]);
        }
        store.clear();
        store.trim();
        Assert.assertEquals(4, store.getCapacity());
        for (int i = 0; i < 100; ++i) {
            store.insertBefore(TAIL, i);
        }
        for (int i = 0; i < slots.length; ++i) {
            Assert.assertFalse(store.isLinked(slots[i], generations[i]));
        }
        Assert.assertEquals(100, store.size());
        Assert.assertNull(store.checkConsistency());
    }

    @Test(expected = IllegalStateException.class)
    public void trimNonEmpty() {
        final NodeStore<Integer> store = new NodeStore<>(4);
        store.insertBefore(TAIL, 0);
        store.trim();
    }

    @Test
    public void brokenChainIsDetected() throws Exception {
        final NodeStore<Integer> store = new NodeStore<>(8);
        final int a = store.insertBefore(TAIL, 0);
        final int b = store.insertBefore(TAIL, 1);
        Assert.assertNull(store.checkConsistency());
        final Field prevField = NodeStore.class.getDeclaredField("prev");
        prevField.setAccessible(true);
        final int[] prev = (int[]) prevField.get(store);
        prev[b] = HEAD;
        Assert.assertEquals("slot " + b + " doesn't link back to slot " + a, store.checkConsistency());
    }

    @Test
    public void dispose() {
        final NodeStore<Integer> store = new NodeStore<>(4);
        final int headGeneration = store.generation(HEAD);
        final int tailGeneration = store.generation(TAIL);
        final int slot = store.insertBefore(TAIL, 0);
        final int generation = store.generation(slot);
        store.dispose();
        Assert.assertFalse(store.isLinked(HEAD, headGeneration));
        Assert.assertFalse(store.isLinked(TAIL, tailGeneration));
        Assert.assertFalse(store.isLinked(slot, generation));
    }

    @Test
    public void growthOfLargeCapacity() {
        Assert.assertEquals(26, NodeStore.grownCapacity(16, 17));
        Assert.assertEquals(100, NodeStore.grownCapacity(16, 100));
        final int large = 1 << 28;
        Assert.assertEquals((int) (((long) large << 3) / 5 + 1), NodeStore.grownCapacity(large, large + 1));
        Assert.assertEquals(NodeStore.MAX_CAPACITY, NodeStore.grownCapacity(1 << 30, (1 << 30) + 1));
        Assert.assertEquals(Integer.MAX_VALUE, NodeStore.grownCapacity(NodeStore.MAX_CAPACITY, Integer.MAX_VALUE));
    }
}
