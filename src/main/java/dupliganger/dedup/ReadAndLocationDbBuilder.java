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

package dupliganger.dedup;

import dupliganger.DupligangerException;
import dupliganger.db.Transaction;
import dupliganger.sam.ReadGroup;
import dupliganger.sam.ReadGroupIterator;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;

import java.util.Iterator;

/**
 * First pass over the input: groups the alignment lines by read name, gives each ReadGroup the next ReadGroup id,
 * and stores it in the read group store and the location index.  Writes are committed every batchSize ReadGroups,
 * and a ReadGroup is never split across two batches.
 */
public class ReadAndLocationDbBuilder {
    private static final Log log = Log.getInstance(ReadAndLocationDbBuilder.class);

    /** ReadGroup ids are zero padded to this many digits, so that they sort numerically. */
    public static final int READ_GROUP_ID_DIGITS = 10;

    private final DedupStores stores;
    private final int batchSize;
    private final boolean paired;

    public ReadAndLocationDbBuilder(final DedupStores stores, final int batchSize, final boolean paired) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.stores = stores;
        this.batchSize = batchSize;
        this.paired = paired;
    }

    /** @return the id of the n-th ReadGroup, counting from 1 */
    public static String toReadGroupId(final long n) {
        return String.format("%0" + READ_GROUP_ID_DIGITS + "d", n);
    }

    /**
     * Stores every ReadGroup of the alignment lines.
     *
     * @return the number of ReadGroups stored
     * @throws DupligangerException in paired mode, if a read name occurs on a single line
     */
    public long build(final Iterator<String> alignmentLines) {
        final ReadGroupIterator readGroups = new ReadGroupIterator(alignmentLines);
        final ProgressLogger progress = new ProgressLogger(log, 1000000, "Stored", "read groups");
        long numReadGroups = 0;

        while (readGroups.hasNext()) {
            final long startTime = System.currentTimeMillis();
            int numInBatch = 0;
            try (Transaction txn = stores.getDatabase().begin(true)) {
                while (numInBatch < batchSize && readGroups.hasNext()) {
                    final ReadGroup readGroup = readGroups.next();
                    if (paired && readGroup.size() == 1) {
                        throw new DupligangerException("Read " + readGroup.getName() + " has no mate on an adjacent line. " +
                                "Paired input must have the mates of each pair on consecutive lines; sort it by read name " +
                                "or run on unpaired data with PAIRED=false.");
                    }
                    final String readGroupId = toReadGroupId(++numReadGroups);
                    stores.getReadGroups().put(txn, readGroupId, readGroup);
                    stores.getLocations().append(txn, readGroupId, readGroup);
                    progress.record(readGroup.get(0).getRname(), readGroup.get(0).getPos());
                    numInBatch++;
                }
                txn.commit();
            }
            log.debug("Committed " + numInBatch + " read groups in " + (System.currentTimeMillis() - startTime) +
                    "ms, " + numReadGroups + " stored so far.");
        }

        log.info("Stored " + numReadGroups + " read groups.");
        return numReadGroups;
    }
}
