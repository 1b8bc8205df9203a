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
import stablelist.AbstractConfig;
import stablelist.ConfigurationStrategy;
import stablelist.InvalidSettingException;
import stablelist.StableListException;
import stablelist.core.dataStructures.Pair;

/**
 * Specifies settings of {@linkplain StableList}. Default settings are specified by {@linkplain #DEFAULT} which
 * is immutable. Any newly created {@code StableListConfig} is filled up with values of system properties, the
 * settings which are not set as system properties get default values.
 * <pre>
 *     final StableList&lt;String&gt; list = StableLists.newInstance(new StableListConfig().setInitialCapacity(1024));
 * </pre>
 * Settings are read once on list creation, changing them later doesn't affect existing lists.
 */
@SuppressWarnings({"WeakerAccess", "unused", "AutoBoxing", "AutoUnboxing"})
public class StableListConfig extends AbstractConfig {

    public static final StableListConfig DEFAULT = new StableListConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public StableListConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new StableListException("Can't make StableListConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * Initial number of node slots allocated by the list, including the two sentinels. Can't be less than
     * {@code 2}. Default value is {@code 16}.
     */
    public static final String INITIAL_CAPACITY = "stablelist.initialCapacity";

    /**
     * If is set to {@code true} the list verifies its chain of nodes after each modification. A broken chain is
     * logged and reported by {@linkplain StableListException}. Default value is {@code false}.
     */
    public static final String CHECK_CHAIN_CONSISTENCY = "stablelist.checkChainConsistency";

    /**
     * If is set to {@code true} {@linkplain StableList#clear()} shrinks node storage back to
     * {@linkplain #INITIAL_CAPACITY}. Default value is {@code false}.
     */
    public static final String TRIM_ON_CLEAR = "stablelist.trimOnClear";

    public static final int MIN_CAPACITY = 2;

    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    public StableListConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings("rawtypes")
    public StableListConfig(@NotNull final ConfigurationStrategy strategy) {
        //noinspection unchecked
        super(new Pair[]{
            new Pair(INITIAL_CAPACITY, DEFAULT_INITIAL_CAPACITY),
            new Pair(CHECK_CHAIN_CONSISTENCY, false),
            new Pair(TRIM_ON_CLEAR, false)
        }, strategy);
        // out of range values fall back to default as malformed ones do
        if (getInitialCapacity() < MIN_CAPACITY) {
            super.setSetting(INITIAL_CAPACITY, DEFAULT_INITIAL_CAPACITY);
        }
    }

    @Override
    public StableListConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        if (INITIAL_CAPACITY.equals(key) && value instanceof Integer && (Integer) value < MIN_CAPACITY) {
            throw new InvalidSettingException("Initial capacity can't be less than " + MIN_CAPACITY + ": " + value);
        }
        return (StableListConfig) super.setSetting(key, value);
    }

    @Override
    public StableListConfig setMutable(boolean isMutable) {
        return (StableListConfig) super.setMutable(isMutable);
    }

    public int getInitialCapacity() {
        return (Integer) getSetting(INITIAL_CAPACITY);
    }

    public StableListConfig setInitialCapacity(final int initialCapacity) {
        return setSetting(INITIAL_CAPACITY, initialCapacity);
    }

    public boolean isCheckChainConsistency() {
        return (Boolean) getSetting(CHECK_CHAIN_CONSISTENCY);
    }

    public StableListConfig setCheckChainConsistency(final boolean checkChainConsistency) {
        return setSetting(CHECK_CHAIN_CONSISTENCY, checkChainConsistency);
    }

    public boolean isTrimOnClear() {
        return (Boolean) getSetting(TRIM_ON_CLEAR);
    }

    public StableListConfig setTrimOnClear(final boolean trimOnClear) {
        return setSetting(TRIM_ON_CLEAR, trimOnClear);
    }
}
