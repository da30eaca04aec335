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

import dupliganger.cmdline.CommandLineProgram;
import dupliganger.cmdline.StandardOptionDefinitions;
import dupliganger.db.Database;
import dupliganger.db.StoreType;
import dupliganger.db.Transaction;
import dupliganger.sam.SamTextSource;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Arguments and steps shared by the programs that build the read group and location stores from an alignment file.
 */
public abstract class AbstractDedupCommandLineProgram extends CommandLineProgram {
    private static final Log log = Log.getInstance(AbstractDedupCommandLineProgram.class);

    /** Suffix of the database file created for the {@link StoreType#DISK} store. */
    public static final String DB_SUFFIX = ".dupliganger.db";
    /** Suffix of debug dump files, which are named {@code <prefix>.<store name><suffix>}. */
    public static final String DUMP_SUFFIX = ".dump.txt";

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME,
            doc = "The SAM (optionally gzipped) or BAM file to deduplicate.  Read names must carry the UMI annotation, " +
                    "and the alignments of each read name must be on consecutive lines.")
    public File INPUT;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_DIR_SHORT_NAME, doc = "Directory to write outputs to.")
    public File OUTPUT_DIR = new File(".");

    @Argument(doc = "Prefix of the output file names.  Defaults to the name of INPUT without its extension.", optional = true)
    public String OUTPUT_PREFIX;

    @Argument(shortName = StandardOptionDefinitions.STORE_SHORT_NAME,
            doc = "Where to keep the stores: on disk, in an embedded database file in OUTPUT_DIR, or in memory.")
    public StoreType STORE = StoreType.DISK;

    @Argument(shortName = StandardOptionDefinitions.BATCH_SIZE_SHORT_NAME,
            doc = "Number of records written to the stores per transaction.")
    public int BATCH_SIZE = 100000;

    @Argument(doc = "Whether the reads are paired.  In paired mode both mates of a pair must be present on consecutive lines.")
    public boolean PAIRED = true;

    @Argument(doc = "Whether to correct the location of each read for the 5' quality trimming recorded in its name.")
    public boolean USE_5P_TRIM_ANNOTATION = true;

    @Argument(doc = "Keep the database file after a successful run instead of deleting it.")
    public boolean KEEP_DB = false;

    @Argument(doc = "Write the read group store to <prefix>.read_group" + DUMP_SUFFIX + " for debugging.")
    public boolean DUMP_READ_GROUP_DB = false;

    @Argument(doc = "Write the location store to <prefix>.location_bucket_store" + DUMP_SUFFIX + " for debugging.")
    public boolean DUMP_LOCATION_DB = false;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (BATCH_SIZE < 1) {
            errors.add("BATCH_SIZE must be positive, was " + BATCH_SIZE + ".");
        }
        collectValidationErrors(errors);
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    /** Subclasses add their own argument checks here. */
    protected void collectValidationErrors(final List<String> errors) { }

    protected String getOutputPrefix() {
        return OUTPUT_PREFIX != null ? OUTPUT_PREFIX : IOUtil.basename(INPUT);
    }

    protected File getDatabaseFile() {
        return new File(OUTPUT_DIR, getOutputPrefix() + DB_SUFFIX);
    }

    protected File getDumpFile(final String storeName) {
        return new File(OUTPUT_DIR, getOutputPrefix() + "." + storeName + DUMP_SUFFIX);
    }

    /** Fails before any input is read if the input cannot be read or the outputs cannot be written. */
    protected void assertPrerequisites() {
        IOUtil.assertFileIsReadable(INPUT);
        IOUtil.assertDirectoryIsWritable(OUTPUT_DIR);
    }

    protected DedupStores openStores() {
        return new DedupStores(Database.create(STORE, getDatabaseFile()), USE_5P_TRIM_ANNOTATION);
    }

    /**
     * Reads INPUT into the read group and location stores.
     *
     * @return the number of ReadGroups stored
     */
    protected long buildReadAndLocationDbs(final DedupStores stores, final DedupMetrics metrics) {
        log.info("Building read group and location stores from " + INPUT.getAbsolutePath());
        final long numReadGroups;
        try (SamTextSource source = SamTextSource.open(INPUT)) {
            numReadGroups = new ReadAndLocationDbBuilder(stores, BATCH_SIZE, PAIRED).build(source.iterator());
        }
        metrics.READ_GROUPS = numReadGroups;
        metrics.HARD_CLIPPED_READ_GROUPS = stores.getLocations().getNumHardClipped();
        reportMemoryStats("After building read group and location stores");
        return numReadGroups;
    }

    /** Writes the requested debug dumps of the read group and location stores. */
    protected void dumpReadAndLocationDbs(final DedupStores stores) {
        try (Transaction txn = stores.getDatabase().begin(false)) {
            if (DUMP_READ_GROUP_DB) {
                stores.getReadGroups().dump(txn, getDumpFile(DedupStores.READ_GROUP_STORE));
            }
            if (DUMP_LOCATION_DB) {
                stores.getLocations().getBuckets().dump(txn, getDumpFile(DedupStores.LOCATION_STORE));
            }
        }
    }

    /** Deletes the database file unless KEEP_DB is set. */
    protected void cleanUpDatabase() {
        final File dbFile = getDatabaseFile();
        if (STORE == StoreType.DISK && !KEEP_DB && dbFile.exists() && !dbFile.delete()) {
            log.warn("Could not delete database file " + dbFile.getAbsolutePath());
        }
    }

    /** Print out some quick JVM memory stats. */
    protected void reportMemoryStats(final String stage) {
        final Runtime runtime = Runtime.getRuntime();
        log.info(stage + " freeMemory: " + runtime.freeMemory() + "; totalMemory: " + runtime.totalMemory() +
                "; maxMemory: " + runtime.maxMemory());
    }
}
