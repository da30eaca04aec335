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

import dupliganger.db.BucketStore;
import dupliganger.db.Database;
import dupliganger.db.LocationBucketDb;
import dupliganger.db.ObjectStore;
import dupliganger.sam.LocationKeys;
import dupliganger.sam.ReadGroup;
import dupliganger.sam.ReadGroupCodec;

import java.io.Closeable;

/**
 * The stores of one deduplication run, all opened on a single Database:
 * <ul>
 *     <li>read groups: ReadGroup id to ReadGroup</li>
 *     <li>locations: location key to the ids of the ReadGroups there</li>
 *     <li>UMI errors: ReadGroup name to its UMI error record</li>
 *     <li>losers: names of the ReadGroups that were found to be duplicates</li>
 * </ul>
 */
public class DedupStores implements Closeable {
    public static final String READ_GROUP_STORE = "read_group";
    public static final String LOCATION_STORE = "location_bucket_store";
    public static final String UMI_ERROR_STORE = "umi_error";
    public static final String LOSER_STORE = "duplicate";

    /** Value stored against each loser. */
    static final String LOSER_SENTINEL = "1";

    private final Database database;
    private final ObjectStore<ReadGroup> readGroups;
    private final LocationBucketDb locations;
    private final ObjectStore<UmiErrorRecord> umiErrors;
    private final BucketStore losers;

    public DedupStores(final Database database, final boolean use5pTrimAnnotation) {
        this.database = database;
        this.readGroups = database.openObjectStore(READ_GROUP_STORE, new ReadGroupCodec());
        this.locations = new LocationBucketDb(database.openBucketStore(LOCATION_STORE), LocationKeys.forTrimming(use5pTrimAnnotation));
        this.umiErrors = database.openObjectStore(UMI_ERROR_STORE, new UmiErrorRecord.Codec());
        this.losers = database.openBucketStore(LOSER_STORE);
    }

    public Database getDatabase() {
        return database;
    }

    public ObjectStore<ReadGroup> getReadGroups() {
        return readGroups;
    }

    public LocationBucketDb getLocations() {
        return locations;
    }

    public ObjectStore<UmiErrorRecord> getUmiErrors() {
        return umiErrors;
    }

    public BucketStore getLosers() {
        return losers;
    }

    @Override
    public void close() {
        database.close();
    }
}
