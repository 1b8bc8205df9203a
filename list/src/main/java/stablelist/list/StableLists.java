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

@SuppressWarnings("UnusedDeclaration")
public final class StableLists {

    private StableLists() {
    }

    @NotNull
    public static <T> StableList<T> newInstance(@NotNull final T... items) {
        return newInstance(new StableListConfig(), Arrays.asList(items));
    }

    @NotNull
    public static <T> StableList<T> newInstance(@NotNull final Iterable<? extends T> items) {
        return newInstance(new StableListConfig(), items);
    }

    @NotNull
    public static <T> StableList<T> newInstance(@NotNull final StableListConfig config) {
        return new StableListImpl<>(config);
    }

    @NotNull
    public static <T> StableList<T> newInstance(@NotNull final StableListConfig config, @NotNull final Iterable<? extends T> items) {
        final StableList<T> result = new StableListImpl<>(config);
        result.pushBack(items);
        return result;
    }
}
