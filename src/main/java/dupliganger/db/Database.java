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
import htsjdk.samtools.util.Log;

import java.io.Closeable;
import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parent of a set of named stores that share one transaction manager.  Stores are opened by name, and every read or
 * write goes through a {@link Transaction} obtained from {@link #begin(boolean)}.  At most one write transaction may
 * be open at a time.
 *
 * Subclasses provide the backing maps and the meaning of commit and abort; the algorithms that use the stores never
 * know which backend they are running against.
 */
public abstract class Database implements Closeable {
    private static final Log log = Log.getInstance(Database.class);

    private final Map<String, Map<String, String>> maps = new LinkedHashMap<>();
    private Transaction openWrite = null;

    /**
     * Creates a database of the given type.
     *
     * @param file the database file; ignored for {@link StoreType#MEMORY}.  Any existing file is deleted first.
     */
    public static Database create(final StoreType type, final File file) {
        switch (type) {
            case MEMORY:
                return new InMemoryDatabase();
            case DISK:
                if (file.exists() && !file.delete()) {
                    throw new DupligangerException("Could not delete stale database file " + file.getAbsolutePath());
                }
                log.info("Creating database " + file.getAbsolutePath());
                return new MvStoreDatabase(file);
            default:
                throw new IllegalArgumentException("Unknown store type: " + type);
        }
    }

    /**
     * Begins a transaction.
     *
     * @param write whether the transaction may modify the stores
     */
    public Transaction begin(final boolean write) {
        if (write) {
            if (openWrite != null) {
                throw new DupligangerException("A write transaction is already open.");
            }
            openWrite = new Transaction(this, true);
            return openWrite;
        }
        return new Transaction(this, false);
    }

    public <T> ObjectStore<T> openObjectStore(final String name, final ItemCodec<T> codec) {
        return new ObjectStore<>(name, getMap(name), codec);
    }

    public BucketStore openBucketStore(final String name) {
        return new BucketStore(name, getMap(name));
    }

    private Map<String, String> getMap(final String name) {
        return maps.computeIfAbsent(name, this::openMap);
    }

    /** @return the backing map for the store of the given name */
    protected abstract Map<String, String> openMap(String name);

    /** Makes all writes since the last commit permanent. */
    protected abstract void commitWrite();

    /** Discards all writes since the last commit. */
    protected abstract void abortWrite();

    void release(final Transaction transaction) {
        if (transaction == openWrite) {
            openWrite = null;
        }
    }

    /** @return true if a write transaction is open and not yet closed */
    protected boolean hasOpenWrite() {
        return openWrite != null;
    }

    @Override
    public abstract void close();
}
