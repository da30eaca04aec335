/*
 * The MIT License
 *
 * Copyright (c) 2016 The Dupliganger Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package dupliganger.db;

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.Map;

/**
 * A store of one object per key, kept in its {@link ItemCodec} encoded form.
 */
public class ObjectStore<T> extends AbstractStore {
    private final ItemCodec<T> codec;

    ObjectStore(final String name, final Map<String, String> map, final ItemCodec<T> codec) {
        super(name, map);
        this.codec = codec;
    }

    public void put(final Transaction txn, final String key, final T item) {
        checkWrite(txn);
        map.put(key, codec.encode(item));
    }

    /** @return the object stored under key, or null if there is none */
    public T get(final Transaction txn, final String key) {
        checkRead(txn);
        final String stored = map.get(key);
        return stored == null ? null : codec.decode(stored);
    }

    public boolean contains(final Transaction txn, final String key) {
        checkRead(txn);
        return map.containsKey(key);
    }

    /** Iterates over every entry of the store in the backend's key order. */
    public Iterator<Map.Entry<String, T>> iterator(final Transaction txn) {
        checkRead(txn);
        final Iterator<Map.Entry<String, String>> entries = map.entrySet().iterator();
        return new Iterator<Map.Entry<String, T>>() {
            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public Map.Entry<String, T> next() {
                final Map.Entry<String, String> entry = entries.next();
                return new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), codec.decode(entry.getValue()));
            }
        };
    }
}
