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

import dupliganger.sam.HardClippingNotSupportedException;
import dupliganger.sam.ReadGroup;
import htsjdk.samtools.util.Log;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Index of ReadGroup ids by location key.  Each ReadGroup appended is filed under the key computed for it by the
 * location function; ReadGroups whose key cannot be computed because they are hard clipped are skipped with a
 * warning and counted.
 */
public class LocationBucketDb {
    private static final Log log = Log.getInstance(LocationBucketDb.class);

    private final BucketStore buckets;
    private final Function<ReadGroup, String> locationFunction;
    private long numHardClipped = 0;

    public LocationBucketDb(final BucketStore buckets, final Function<ReadGroup, String> locationFunction) {
        this.buckets = buckets;
        this.locationFunction = locationFunction;
    }

    /**
     * Files a ReadGroup id under the location of the ReadGroup.
     *
     * @return true if the ReadGroup was indexed, false if it was skipped for hard clipping
     */
    public boolean append(final Transaction txn, final String readGroupId, final ReadGroup readGroup) {
        final String location;
        try {
            location = locationFunction.apply(readGroup);
        } catch (final HardClippingNotSupportedException e) {
            numHardClipped++;
            log.warn("Skipping read " + readGroup.getName() + ", hard clipping is not supported: " + e.getMessage());
            return false;
        }
        buckets.append(txn, location, readGroupId);
        return true;
    }

    public List<String> get(final Transaction txn, final String location) {
        return buckets.get(txn, location);
    }

    public Iterator<Map.Entry<String, List<String>>> iterator(final Transaction txn) {
        return buckets.iterator(txn);
    }

    public BucketStore getBuckets() {
        return buckets;
    }

    /** @return the number of ReadGroups skipped because they were hard clipped */
    public long getNumHardClipped() {
        return numHardClipped;
    }
}
