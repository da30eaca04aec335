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

/**
 * A write transaction that commits and renews itself every batchSize records, bounding the amount of uncommitted
 * data held by the backend.  Closing it without a final {@link #commit()} aborts the current batch only.
 */
public class BatchedTransaction implements AutoCloseable {
    private final Database database;
    private final int batchSize;
    private Transaction current;
    private int numInBatch = 0;
    private long numBatchesCommitted = 0;

    public BatchedTransaction(final Database database, final int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.database = database;
        this.batchSize = batchSize;
        this.current = database.begin(true);
    }

    /** @return the transaction to write the next record with */
    public Transaction get() {
        return current;
    }

    /** Counts a record as written, committing and starting a new transaction if the batch is full. */
    public void recordWritten() {
        if (++numInBatch >= batchSize) {
            commit();
            current = database.begin(true);
        }
    }

    /** Commits the current batch. */
    public void commit() {
        current.commit();
        current.close();
        numBatchesCommitted++;
        numInBatch = 0;
    }

    public long getNumBatchesCommitted() {
        return numBatchesCommitted;
    }

    @Override
    public void close() {
        current.close();
    }
}
