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

/**
 * A read or write transaction against a {@link Database}.  Closing a write transaction that was never committed
 * aborts it, so that a try-with-resources block left by an exception leaves the stores as they were at the last
 * commit.
 */
public final class Transaction implements AutoCloseable {
    private final Database database;
    private final boolean write;
    private boolean committed = false;
    private boolean closed = false;

    Transaction(final Database database, final boolean write) {
        this.database = database;
        this.write = write;
    }

    public boolean isWrite() {
        return write;
    }

    Database getDatabase() {
        return database;
    }

    /** Makes the writes of this transaction permanent.  A transaction may be committed once. */
    public void commit() {
        assertOpen();
        if (committed) {
            throw new DupligangerException("Transaction has already been committed.");
        }
        if (write) {
            database.commitWrite();
        }
        committed = true;
    }

    void assertOpen() {
        if (closed) {
            throw new DupligangerException("Transaction has already been closed.");
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (write && !committed) {
            database.abortWrite();
        }
        database.release(this);
    }
}
