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

import dupliganger.cmdline.StandardOptionDefinitions;
import dupliganger.cmdline.programgroups.ReadDataManipulationProgramGroup;
import dupliganger.db.Transaction;
import dupliganger.sam.SamTextSource;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * <p>Removes PCR duplicates from an alignment file whose read names carry UMI annotations.</p>
 *
 * <p>Two ReadGroups (read pairs, or single reads) are duplicates when they align to the same soft-clip and 5'-trim
 * corrected location and carry the same UMIs.  One ReadGroup of each set of duplicates is chosen at random, with a
 * fixed seed, and kept; the others are removed.</p>
 *
 * <h4>Usage example:</h4>
 * <pre>
 * dupliganger Dedup \
 *      --INPUT aligned.sam \
 *      --OUTPUT_DIR out
 * </pre>
 */
@CommandLineProgramProperties(
        summary = Dedup.USAGE_SUMMARY + Dedup.USAGE_DETAILS,
        oneLineSummary = Dedup.USAGE_SUMMARY,
        programGroup = ReadDataManipulationProgramGroup.class
)
public class Dedup extends AbstractDedupCommandLineProgram {
    static final String USAGE_SUMMARY = "Removes PCR duplicates using read positions and UMIs. ";
    static final String USAGE_DETAILS = "<p>Two read groups (read pairs, or single reads) are duplicates when they align to " +
            "the same soft-clip and 5'-trim corrected location and carry the same UMIs.  One read group of each set of " +
            "duplicates is kept; the choice is random, but reproducible for a given RANDOM_SEED.</p>" +
            "<p>UMIs that are not known UMIs of the KIT are UMI errors.  By default, read groups with UMI errors are " +
            "rejected; with REJECT_UMI_ERRORS=false they are kept as sequenced, and with CORRECT_UMIS=true as well, each " +
            "UMI one base away from exactly one known UMI is corrected to it.</p>" +
            "<h4>Usage example:</h4>" +
            "<pre>" +
            "dupliganger Dedup --INPUT aligned.sam --OUTPUT_DIR out" +
            "</pre>";

    public static final long DEFAULT_RANDOM_SEED = 20160101L;
    public static final String METRICS_SUFFIX = ".dedup_metrics.txt";

    private final Log log = Log.getInstance(Dedup.class);

    @Argument(shortName = StandardOptionDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "File to write deduplication metrics to.  Defaults to <prefix>" + METRICS_SUFFIX + " in OUTPUT_DIR.",
            optional = true)
    public File METRICS_FILE;

    @Argument(shortName = StandardOptionDefinitions.KIT_SHORT_NAME, doc = "The UMI kit the library was prepared with.")
    public UmiKit KIT = UmiKit.BIOO;

    @Argument(doc = "Reject read groups with a UMI that is not a known UMI of the KIT, writing them to the UMI error file.")
    public boolean REJECT_UMI_ERRORS = true;

    @Argument(doc = "Correct each UMI that is one base away from exactly one known UMI of the KIT.  " +
            "Requires REJECT_UMI_ERRORS=false.")
    public boolean CORRECT_UMIS = false;

    @Argument(doc = "Seed of the random choice of the read group to keep from each set of duplicates.")
    public long RANDOM_SEED = DEFAULT_RANDOM_SEED;

    @Argument(doc = "Write the input with duplicates removed.")
    public boolean WRITE_DEDUPPED_SAM = true;

    @Argument(doc = "Write the input with duplicates flagged 0x400 rather than removed.")
    public boolean WRITE_FLAGGED_SAM = false;

    @Argument(doc = "Write a SAM file of the duplicates only.")
    public boolean WRITE_DUP_ONLY_SAM = true;

    @Argument(doc = "Write a SAM-like file listing the reads of each duplicate group.")
    public boolean WRITE_DUP_GROUP_FILE = true;

    @Argument(doc = "Write a SAM file of the read groups rejected for UMI errors.")
    public boolean WRITE_UMI_ERROR_SAM = true;

    @Argument(doc = "Copy the input header, plus a @PG line, to each SAM output.")
    public boolean WRITE_SAM_HEADERS = true;

    @Argument(doc = "Write the duplicate group index to <prefix>.dup_group" + DUMP_SUFFIX + " for debugging.")
    public boolean DUMP_DUP_GROUP_DB = false;

    @Argument(doc = "Write the loser store to <prefix>." + DedupStores.LOSER_STORE + DUMP_SUFFIX + " for debugging.")
    public boolean DUMP_LOSERS_DB = false;

    @Argument(doc = "Write the UMI error store to <prefix>." + DedupStores.UMI_ERROR_STORE + DUMP_SUFFIX + " for debugging.")
    public boolean DUMP_UMI_ERROR_DB = false;

    @Override
    protected void collectValidationErrors(final List<String> errors) {
        if (REJECT_UMI_ERRORS && CORRECT_UMIS) {
            errors.add("Cannot both reject and correct UMI errors.  To correct UMIs, set REJECT_UMI_ERRORS=false.");
        }
    }

    UmiErrorPolicy getUmiErrorPolicy() {
        if (REJECT_UMI_ERRORS) return UmiErrorPolicy.REJECT;
        return CORRECT_UMIS ? UmiErrorPolicy.CORRECT : UmiErrorPolicy.KEEP;
    }

    Set<DedupOutput> getEnabledOutputs() {
        final Set<DedupOutput> enabled = EnumSet.noneOf(DedupOutput.class);
        if (WRITE_DEDUPPED_SAM) enabled.add(DedupOutput.DEDUPPED);
        if (WRITE_FLAGGED_SAM) enabled.add(DedupOutput.FLAGGED);
        if (WRITE_DUP_ONLY_SAM) enabled.add(DedupOutput.DUPLICATES);
        if (WRITE_DUP_GROUP_FILE) enabled.add(DedupOutput.DUP_GROUPS);
        if (WRITE_UMI_ERROR_SAM) enabled.add(DedupOutput.UMI_ERRORS);
        return enabled;
    }

    File getMetricsOutput() {
        return METRICS_FILE != null ? METRICS_FILE : new File(OUTPUT_DIR, getOutputPrefix() + METRICS_SUFFIX);
    }

    @Override
    protected int doWork() {
        assertPrerequisites();
        final File metricsOutput = getMetricsOutput();
        IOUtil.assertFileIsWritable(metricsOutput);

        final UmiErrorPolicy umiErrorPolicy = getUmiErrorPolicy();
        final DedupReport report = new DedupReport(KIT.getUmiLength());

        try (DedupStores stores = openStores()) {
            buildReadAndLocationDbs(stores, report.getMetrics());

            final DuplicateResolver resolver = new DuplicateResolver(stores, KIT, umiErrorPolicy, report, BATCH_SIZE, RANDOM_SEED);
            resolver.findDuplicateGroups();
            reportMemoryStats("After finding duplicate groups");
            resolver.selectWinners();
            reportMemoryStats("After selecting winners");

            try (DedupOutputs outputs = new DedupOutputs(OUTPUT_DIR, getOutputPrefix(), getEnabledOutputs())) {
                try (Transaction txn = stores.getDatabase().begin(false)) {
                    new DuplicateGroupFileWriter(stores.getReadGroups())
                            .write(txn, resolver.getDuplicateGroups().getGroups(), outputs.get(DedupOutput.DUP_GROUPS));
                }

                final String programRecord = SamReconciler.buildProgramRecord(PROGRAM_NAME, getVersion(), getCommandLine());
                try (SamTextSource source = SamTextSource.open(INPUT)) {
                    new SamReconciler(stores, umiErrorPolicy, WRITE_SAM_HEADERS, programRecord).reconcile(source, outputs);
                }
                outputs.commit();
            }
            reportMemoryStats("After writing outputs");

            dumpReadAndLocationDbs(stores);
            dumpResolutionDbs(stores, resolver.getDuplicateGroups());
        }

        report.log(log);
        report.write(getMetricsFile(), metricsOutput);
        cleanUpDatabase();
        return 0;
    }

    private void dumpResolutionDbs(final DedupStores stores, final DuplicateGroupIndex duplicateGroups) {
        try (Transaction txn = stores.getDatabase().begin(false)) {
            if (DUMP_LOSERS_DB) {
                stores.getLosers().dump(txn, getDumpFile(DedupStores.LOSER_STORE));
            }
            if (DUMP_UMI_ERROR_DB) {
                stores.getUmiErrors().dump(txn, getDumpFile(DedupStores.UMI_ERROR_STORE));
            }
        }
        if (DUMP_DUP_GROUP_DB) {
            try (BufferedWriter out = IOUtil.openFileForBufferedWriting(getDumpFile("dup_group"))) {
                for (final String line : duplicateGroups.dump()) {
                    out.write(line);
                    out.newLine();
                }
            } catch (final IOException e) {
                throw new RuntimeIOException("Error writing duplicate group dump", e);
            }
        }
    }
}
