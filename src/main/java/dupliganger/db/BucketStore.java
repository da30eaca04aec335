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

import dupliganger.DupligangerException;
import org.apache.commons.lang3.StringUtils;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A store of an append-only list of items per key.  Items may not contain {@link #DELIM_BUCKET}.
 */
public class BucketStore extends AbstractStore {
    public static final char DELIM_BUCKET = ',';

    BucketStore(final String name, final Map<String, String> map) {
        super(name, map);
    }

    /** Replaces the list stored under key. */
    public void put(final Transaction txn, final String key, final List<String> items) {
        checkWrite(txn);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot store an empty bucket under " + key);
        }
        for (final String item : items) checkItem(item);
        map.put(key, StringUtils.join(items, DELIM_BUCKET));
    }

    /** Appends an item to the list stored under key, creating the list if needed. */
    public void append(final Transaction txn, final String key, final String item) {
        checkWrite(txn);
        checkItem(item);
        final String existing = map.get(key);
        map.put(key, existing == null ? item : existing + DELIM_BUCKET + item);
    }

    /** Appends several items to the list stored under key in one write. */
    public void appendAll(final Transaction txn, final String key, final Collection<String> items) {
        checkWrite(txn);
        if (items.isEmpty()) return;
        for (final String item : items) checkItem(item);
        final String joined = StringUtils.join(items, DELIM_BUCKET);
        final String existing = map.get(key);
        map.put(key, existing == null ? joined : existing + DELIM_BUCKET + joined);
    }

    /** @return the list stored under key, or null if there is none */
    public List<String> get(final Transaction txn, final String key) {
        checkRead(txn);
        final String stored = map.get(key);
        return stored == null ? null : split(stored);
    }

    /** Iterates over every bucket of the store in the backend's key order. */
    public Iterator<Map.Entry<String, List<String>>> iterator(final Transaction txn) {
        checkRead(txn);
        final Iterator<Map.Entry<String, String>> entries = map.entrySet().iterator();
        return new Iterator<Map.Entry<String, List<String>>>() {
            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public Map.Entry<String, List<String>> next() {
                final Map.Entry<String, String> entry = entries.next();
                return new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), split(entry.getValue()));
            }
        };
    }

    private static List<String> split(final String stored) {
        return Arrays.asList(StringUtils.splitPreserveAllTokens(stored, DELIM_BUCKET));
    }

    private static void checkItem(final String item) {
        if (item.isEmpty() || item.indexOf(DELIM_BUCKET) >= 0) {
            throw new DupligangerException("Bucket items must be non-empty and may not contain '" + DELIM_BUCKET +
                    "': " + item);
        }
    }
}
