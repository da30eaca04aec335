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
import dupliganger.cmdline.CommandLineProgramTest;
import htsjdk.samtools.SAMFileWriter;
import htsjdk.samtools.SAMFileWriterFactory;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.metrics.MetricsFile;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class DedupTest extends CommandLineProgramTest {
    private static final File TEST_DATA_DIR = new File(CommandLineProgramTest.TEST_DATA_DIR, "dedup");

    @Override
    public String getCommandLineProgramName() {
        return Dedup.class.getSimpleName();
    }

    private static List<String> args(final File input, final File outputDir, final String... extra) {
        final List<String> args = new ArrayList<>(Arrays.asList(
                "--INPUT", input.getAbsolutePath(),
                "--OUTPUT_DIR", outputDir.getAbsolutePath(),
                "--QUIET", "true"));
        args.addAll(Arrays.asList(extra));
        return args;
    }

    private static DedupMetrics readMetrics(final File file) throws IOException {
        final MetricsFile<DedupMetrics, Integer> metricsFile = new MetricsFile<>();
        try (FileReader reader = new FileReader(file)) {
            metricsFile.read(reader);
        }
        Assert.assertEquals(metricsFile.getMetrics().size(), 1);
        return metricsFile.getMetrics().get(0);
    }

    private static List<String> alignmentLines(final File file) throws IOException {
        return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8).stream()
                .filter(line -> !line.startsWith("@"))
                .collect(Collectors.toList());
    }

    private static List<String> qnames(final List<String> lines) {
        return lines.stream().map(line -> line.substring(0, line.indexOf('\t'))).sorted().collect(Collectors.toList());
    }

    @Test
    public void testDefaults() throws IOException {
        final File outputDir = newTempOutputDir("defaults");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir)), 0);

        final DedupMetrics metrics = readMetrics(new File(outputDir, "dups" + Dedup.METRICS_SUFFIX));
        Assert.assertEquals(metrics.READ_GROUPS, 6);
        Assert.assertEquals(metrics.HARD_CLIPPED_READ_GROUPS, 1);
        Assert.assertEquals(metrics.LOCATIONS, 2);
        Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 3);
        Assert.assertEquals(metrics.DUP_GROUPS, 1);
        Assert.assertEquals(metrics.DUPLICATE_READ_GROUPS, 2);
        Assert.assertEquals(metrics.READ_GROUPS_WITH_UMI_ERROR, 0);

        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.DEDUPPED.getFileName("dups"))).size(), 8);
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.DUPLICATES.getFileName("dups"))).size(), 4);
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.UMI_ERRORS.getFileName("dups"))).size(), 0);
        Assert.assertEquals(Files.readAllLines(new File(outputDir, DedupOutput.DUP_GROUPS.getFileName("dups")).toPath()).size(), 6);
        // flagged output is off by default
        Assert.assertFalse(new File(outputDir, DedupOutput.FLAGGED.getFileName("dups")).exists());

        // the database is removed after a successful run, and no temporary file is left behind
        Assert.assertFalse(new File(outputDir, "dups" + AbstractDedupCommandLineProgram.DB_SUFFIX).exists());
        for (final String name : outputDir.list()) {
            Assert.assertFalse(name.endsWith(DedupOutputs.TMP_SUFFIX), name);
        }
    }

    @Test
    public void testDedupIsReproducible() throws IOException {
        final List<List<String>> duplicates = new ArrayList<>();
        for (final String store : new String[]{"DISK", "MEMORY", "DISK"}) {
            final File outputDir = newTempOutputDir("repro");
            Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir,
                    "--STORE", store, "--BATCH_SIZE", "1")), 0);
            duplicates.add(alignmentLines(new File(outputDir, DedupOutput.DUPLICATES.getFileName("dups"))));
        }
        Assert.assertEquals(duplicates.get(1), duplicates.get(0));
        Assert.assertEquals(duplicates.get(2), duplicates.get(0));
    }

    @Test
    public void testFlaggedOnly() throws IOException {
        final File outputDir = newTempOutputDir("flagged");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir,
                "--OUTPUT_PREFIX", "sample",
                "--WRITE_DEDUPPED_SAM", "false",
                "--WRITE_FLAGGED_SAM", "true",
                "--WRITE_DUP_ONLY_SAM", "false",
                "--WRITE_DUP_GROUP_FILE", "false",
                "--WRITE_UMI_ERROR_SAM", "false")), 0);

        final List<String> flagged = alignmentLines(new File(outputDir, DedupOutput.FLAGGED.getFileName("sample")));
        Assert.assertEquals(flagged.size(), 12);
        Assert.assertEquals(flagged.stream().filter(line -> (Integer.parseInt(line.split("\t")[1]) & 0x400) != 0).count(), 4);
        for (final DedupOutput output : new DedupOutput[]{DedupOutput.DEDUPPED, DedupOutput.DUPLICATES,
                DedupOutput.DUP_GROUPS, DedupOutput.UMI_ERRORS}) {
            Assert.assertFalse(new File(outputDir, output.getFileName("sample")).exists(), output.name());
        }
        Assert.assertTrue(new File(outputDir, "sample" + Dedup.METRICS_SUFFIX).exists());
    }

    @Test
    public void testWithout5pTrimAnnotation() throws IOException {
        final File outputDir = newTempOutputDir("no5ptrim");
        final File metricsFile = new File(outputDir, "custom_metrics.txt");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir,
                "--USE_5P_TRIM_ANNOTATION", "false", "--METRICS_FILE", metricsFile.getAbsolutePath())), 0);

        final DedupMetrics metrics = readMetrics(metricsFile);
        Assert.assertEquals(metrics.LOCATIONS, 3);
        Assert.assertEquals(metrics.DUP_GROUPS, 1);
        Assert.assertEquals(metrics.DUPLICATE_READ_GROUPS, 1);
    }

    @Test
    public void testGzippedInput() throws IOException {
        final File outputDir = newTempOutputDir("gzipped");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam.gz"), outputDir,
                "--OUTPUT_PREFIX", "dups")), 0);
        Assert.assertEquals(readMetrics(new File(outputDir, "dups" + Dedup.METRICS_SUFFIX)).DUPLICATE_READ_GROUPS, 2);
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.DEDUPPED.getFileName("dups"))).size(), 8);
    }

    @Test
    public void testBamInput() throws IOException {
        final File outputDir = newTempOutputDir("bam");
        final File bam = new File(outputDir, "dups.bam");
        try (SamReader reader = SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT)
                .open(new File(TEST_DATA_DIR, "dups.sam"));
             SAMFileWriter writer = new SAMFileWriterFactory().makeBAMWriter(reader.getFileHeader(), true, bam)) {
            for (final SAMRecord record : reader) {
                writer.addAlignment(record);
            }
        }

        Assert.assertEquals(runDupligangerCommandLine(args(bam, outputDir)), 0);
        final DedupMetrics metrics = readMetrics(new File(outputDir, "dups" + Dedup.METRICS_SUFFIX));
        Assert.assertEquals(metrics.READ_GROUPS, 6);
        Assert.assertEquals(metrics.DUPLICATE_READ_GROUPS, 2);

        final File samOutputDir = newTempOutputDir("sam");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), samOutputDir)), 0);
        Assert.assertEquals(qnames(alignmentLines(new File(outputDir, DedupOutput.DEDUPPED.getFileName("dups")))),
                qnames(alignmentLines(new File(samOutputDir, DedupOutput.DEDUPPED.getFileName("dups")))));
    }

    @Test
    public void testRejectUmiErrors() throws IOException {
        final File outputDir = newTempOutputDir("reject");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "umi_errors.sam"), outputDir)), 0);

        final DedupMetrics metrics = readMetrics(new File(outputDir, "umi_errors" + Dedup.METRICS_SUFFIX));
        Assert.assertEquals(metrics.READ_GROUPS_WITH_UMI_ERROR, 2);
        Assert.assertEquals(metrics.READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR, 2);
        Assert.assertEquals(metrics.READ_GROUPS_WITH_CORRECTED_UMI, 0);
        Assert.assertEquals(metrics.DUP_GROUPS, 0);
        Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 2);

        final List<String> umiErrors = alignmentLines(new File(outputDir, DedupOutput.UMI_ERRORS.getFileName("umi_errors")));
        Assert.assertEquals(qnames(umiErrors), Arrays.asList(
                "e2-GGCCTAAA^AGCTCTAG;0^0", "e2-GGCCTAAA^AGCTCTAG;0^0",
                "e3-TAGGTACG^AGCTCTAG;0^0", "e3-TAGGTACG^AGCTCTAG;0^0"));
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.DEDUPPED.getFileName("umi_errors"))).size(), 4);
    }

    @Test
    public void testCorrectUmis() throws IOException {
        final File outputDir = newTempOutputDir("correct");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "umi_errors.sam"), outputDir,
                "--REJECT_UMI_ERRORS", "false", "--CORRECT_UMIS", "true", "--STORE", "MEMORY")), 0);

        final DedupMetrics metrics = readMetrics(new File(outputDir, "umi_errors" + Dedup.METRICS_SUFFIX));
        Assert.assertEquals(metrics.READ_GROUPS_WITH_CORRECTED_UMI, 1);
        Assert.assertEquals(metrics.READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR, 0);
        Assert.assertEquals(metrics.DUP_GROUPS, 1);
        Assert.assertEquals(metrics.DUPLICATE_READ_GROUPS, 1);
        Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 3);
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.UMI_ERRORS.getFileName("umi_errors"))).size(), 0);
    }

    @Test
    public void testKeepUmiErrors() throws IOException {
        final File outputDir = newTempOutputDir("keep");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "umi_errors.sam"), outputDir,
                "--REJECT_UMI_ERRORS", "false")), 0);

        final DedupMetrics metrics = readMetrics(new File(outputDir, "umi_errors" + Dedup.METRICS_SUFFIX));
        Assert.assertEquals(metrics.READ_GROUPS_WITH_UMI_ERROR, 2);
        Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 4);
        Assert.assertEquals(metrics.DUP_GROUPS, 0);
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.DEDUPPED.getFileName("umi_errors"))).size(), 8);
    }

    @Test
    public void testUnpaired() throws IOException {
        final File outputDir = newTempOutputDir("unpaired");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "unpaired.sam"), outputDir,
                "--PAIRED", "false")), 0);

        final DedupMetrics metrics = readMetrics(new File(outputDir, "unpaired" + Dedup.METRICS_SUFFIX));
        Assert.assertEquals(metrics.READ_GROUPS, 4);
        Assert.assertEquals(metrics.LOCATIONS, 2);
        Assert.assertEquals(metrics.DUP_GROUPS, 1);
        Assert.assertEquals(metrics.DUPLICATE_READ_GROUPS, 1);
        Assert.assertEquals(alignmentLines(new File(outputDir, DedupOutput.DEDUPPED.getFileName("unpaired"))).size(), 3);
    }

    @Test
    public void testDumpsAndKeptDatabase() {
        final File outputDir = newTempOutputDirUnchecked("dumps");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir,
                "--KEEP_DB", "true",
                "--DUMP_READ_GROUP_DB", "true",
                "--DUMP_LOCATION_DB", "true",
                "--DUMP_DUP_GROUP_DB", "true",
                "--DUMP_LOSERS_DB", "true",
                "--DUMP_UMI_ERROR_DB", "true")), 0);

        Assert.assertTrue(new File(outputDir, "dups" + AbstractDedupCommandLineProgram.DB_SUFFIX).exists());
        for (final String store : new String[]{DedupStores.READ_GROUP_STORE, DedupStores.LOCATION_STORE, "dup_group",
                DedupStores.LOSER_STORE, DedupStores.UMI_ERROR_STORE}) {
            Assert.assertTrue(new File(outputDir, "dups." + store + AbstractDedupCommandLineProgram.DUMP_SUFFIX).exists(), store);
        }
    }

    @Test
    public void testRejectAndCorrectAreExclusive() {
        final File outputDir = newTempOutputDirUnchecked("conflict");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir,
                "--REJECT_UMI_ERRORS", "true", "--CORRECT_UMIS", "true")), 1);
        Assert.assertEquals(outputDir.list().length, 0);
    }

    @Test
    public void testBadBatchSize() {
        final File outputDir = newTempOutputDirUnchecked("batch");
        Assert.assertEquals(runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "dups.sam"), outputDir,
                "--BATCH_SIZE", "0")), 1);
    }

    @Test(expectedExceptions = DupligangerException.class)
    public void testMatesNotAdjacent() {
        final File outputDir = newTempOutputDirUnchecked("adjacent");
        runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "mates_not_adjacent.sam"), outputDir));
    }

    @Test(expectedExceptions = DupligangerException.class)
    public void testUnpairedInputInPairedMode() {
        final File outputDir = newTempOutputDirUnchecked("paired");
        runDupligangerCommandLine(args(new File(TEST_DATA_DIR, "unpaired.sam"), outputDir, "--STORE", "MEMORY"));
    }

    private File newTempOutputDirUnchecked(final String name) {
        try {
            return newTempOutputDir(name);
        } catch (final IOException e) {
            throw new AssertionError(e);
        }
    }
}
