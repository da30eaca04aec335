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
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;

import java.io.File;
import java.util.Map;

/**
 * A Database backed by an H2 MVStore file, one MVMap per store.  Auto-commit is disabled so that the only writes
 * that reach the file are those of committed transactions; an aborted transaction rolls the store back to its last
 * committed version.
 */
public class MvStoreDatabase extends Database {
    private static final Log log = Log.getInstance(MvStoreDatabase.class);

    private final File file;
    private final MVStore store;

    public MvStoreDatabase(final File file) {
        this.file = file;
        try {
            this.store = new MVStore.Builder()
                    .fileName(file.getAbsolutePath())
                    .autoCommitDisabled()
                    .autoCommitBufferSize(0)
                    .open();
        } catch (final MVStoreException e) {
            throw new DupligangerException("Could not open database file " + file.getAbsolutePath(), e);
        }
    }

    @Override
    protected Map<String, String> openMap(final String name) {
        if (hasOpenWrite()) {
            throw new DupligangerException("Cannot open store '" + name + "' while a write transaction is open.");
        }
        final Map<String, String> map = store.openMap(name);
        // a rollback closes maps created since the last commit
        store.commit();
        return map;
    }

    @Override
    protected void commitWrite() {
        store.commit();
    }

    @Override
    protected void abortWrite() {
        log.debug("Rolling back uncommitted writes to " + file.getName());
        store.rollback();
    }

    @Override
    public void close() {
        if (store.isClosed()) return;
        if (hasOpenWrite()) {
            store.rollback();
        }
        store.close();
    }
}
