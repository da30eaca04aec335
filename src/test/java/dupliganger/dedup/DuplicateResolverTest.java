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

import dupliganger.db.BatchedTransaction;
import dupliganger.db.Database;
import dupliganger.db.StoreType;
import dupliganger.db.Transaction;
import dupliganger.sam.SamTextSource;
import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class DuplicateResolverTest {
    private File tempDir;
    private int dbCount = 0;

    @BeforeClass
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory(getClass().getSimpleName()).toFile();
    }

    @AfterClass
    public void tearDown() throws IOException {
        FileUtils.deleteDirectory(tempDir);
    }

    private DedupStores buildStores(final StoreType type, final String input, final boolean paired, final boolean use5pTrim) {
        final DedupStores stores = new DedupStores(Database.create(type, new File(tempDir, "test" + (dbCount++) + ".db")), use5pTrim);
        try (SamTextSource source = SamTextSource.open(new File(ReadAndLocationDbBuilderTest.TEST_DATA_DIR, input))) {
            new ReadAndLocationDbBuilder(stores, 2, paired).build(source.iterator());
        }
        return stores;
    }

    private static List<String> losers(final DedupStores stores) {
        final List<String> losers = new ArrayList<>();
        try (Transaction txn = stores.getDatabase().begin(false)) {
            for (final String line : stores.getLosers().dump(txn)) {
                losers.add(line.substring(0, line.indexOf(": ")));
            }
        }
        return losers;
    }

    @DataProvider(name = "storeTypes")
    public Object[][] storeTypes() {
        return new Object[][]{{StoreType.MEMORY}, {StoreType.DISK}};
    }

    @Test(dataProvider = "storeTypes")
    public void testFindDuplicateGroups(final StoreType type) {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(type, "dups.sam", true, true)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT, report, 1, 1L);
            final DuplicateGroupIndex index = resolver.findDuplicateGroups();

            Assert.assertEquals(index.getGroups().size(), 1);
            Assert.assertEquals(index.getGroups().get(0).getReadGroupIds(),
                    Arrays.asList("0000000001", "0000000002", "0000000003"));
            Assert.assertNull(index.get("0000000004"));

            final DedupMetrics metrics = report.getMetrics();
            Assert.assertEquals(metrics.LOCATIONS, 2);
            Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 3);
            Assert.assertEquals(metrics.DUP_GROUPS, 1);
            Assert.assertEquals(metrics.READ_GROUPS_WITH_UMI_ERROR, 0);

            Assert.assertEquals(resolver.selectWinners(), 2);
            Assert.assertEquals(metrics.DUPLICATE_READ_GROUPS, 2);
            final List<String> losers = losers(stores);
            Assert.assertEquals(losers.size(), 2);
            for (final String loser : losers) {
                Assert.assertTrue(loser.startsWith("p1-") || loser.startsWith("p2-") || loser.startsWith("p3-"), loser);
            }
        }
    }

    @Test
    public void testWinnersAreReproducible() {
        final List<List<String>> runs = new ArrayList<>();
        for (final StoreType type : new StoreType[]{StoreType.MEMORY, StoreType.DISK, StoreType.MEMORY}) {
            try (DedupStores stores = buildStores(type, "dups.sam", true, true)) {
                final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT,
                        new DedupReport(UmiKit.BIOO.getUmiLength()), 100, Dedup.DEFAULT_RANDOM_SEED);
                resolver.findDuplicateGroups();
                resolver.selectWinners();
                runs.add(losers(stores));
            }
        }
        Assert.assertEquals(runs.get(1), runs.get(0));
        Assert.assertEquals(runs.get(2), runs.get(0));
    }

    @Test
    public void testEverySeedLeavesOneWinner() {
        for (long seed = 0; seed < 20; seed++) {
            try (DedupStores stores = buildStores(StoreType.MEMORY, "dups.sam", true, true)) {
                final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT,
                        new DedupReport(UmiKit.BIOO.getUmiLength()), 100, seed);
                resolver.findDuplicateGroups();
                Assert.assertEquals(resolver.selectWinners(), 2, "seed " + seed);
                Assert.assertEquals(losers(stores).size(), 2, "seed " + seed);
            }
        }
    }

    @Test
    public void testWithout5pTrim() {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(StoreType.MEMORY, "dups.sam", true, false)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT, report, 100, 1L);
            final DuplicateGroupIndex index = resolver.findDuplicateGroups();
            Assert.assertEquals(report.getMetrics().LOCATIONS, 3);
            Assert.assertEquals(index.getGroups().size(), 1);
            Assert.assertEquals(index.getGroups().get(0).getReadGroupIds(), Arrays.asList("0000000001", "0000000003"));
            Assert.assertEquals(resolver.selectWinners(), 1);
        }
    }

    @Test
    public void testUnpaired() {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(StoreType.MEMORY, "unpaired.sam", false, true)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT, report, 100, 1L);
            final DuplicateGroupIndex index = resolver.findDuplicateGroups();
            Assert.assertEquals(index.getGroups().size(), 1);
            Assert.assertEquals(index.getGroups().get(0).getReadGroupIds(), Arrays.asList("0000000001", "0000000002"));
            Assert.assertEquals(report.getMetrics().LOCATIONS, 2);
            Assert.assertEquals(report.getMetrics().UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 3);
            Assert.assertEquals(resolver.selectWinners(), 1);
        }
    }

    @Test(dataProvider = "storeTypes")
    public void testRejectUmiErrors(final StoreType type) {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(type, "umi_errors.sam", true, true)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT, report, 1, 1L);
            Assert.assertTrue(resolver.findDuplicateGroups().getGroups().isEmpty());

            final DedupMetrics metrics = report.getMetrics();
            Assert.assertEquals(metrics.READ_GROUPS_WITH_UMI_ERROR, 2);
            Assert.assertEquals(metrics.READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR, 2);
            Assert.assertEquals(metrics.READ_GROUPS_WITH_CORRECTED_UMI, 0);
            Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 2);
            Assert.assertEquals(metrics.DUP_GROUPS, 0);
            Assert.assertEquals(report.getUmiErrorsByDistance().get(1).getValue(), 2.0, 0.0);
            Assert.assertEquals(report.getRejectsByDistance().get(1).getValue(), 2.0, 0.0);

            try (Transaction txn = stores.getDatabase().begin(false)) {
                final UmiErrorRecord e2 = stores.getUmiErrors().get(txn, "e2-GGCCTAAA^AGCTCTAG;0^0");
                Assert.assertEquals(e2.getMates(), Arrays.asList(
                        new UmiErrorRecord.MateUmiError(1, 1, null),
                        new UmiErrorRecord.MateUmiError(0, 1, null)));
                final UmiErrorRecord e3 = stores.getUmiErrors().get(txn, "e3-TAGGTACG^AGCTCTAG;0^0");
                Assert.assertEquals(e3.getMates().get(0), new UmiErrorRecord.MateUmiError(1, 2, null));
                // e4 is alone at its location, so its UMIs are never examined
                Assert.assertNull(stores.getUmiErrors().get(txn, "e4-GGCCTAAA^AGCTCTAG;0^0"));
            }
            Assert.assertEquals(resolver.selectWinners(), 0);
        }
    }

    @Test
    public void testCorrectUmiErrors() {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(StoreType.DISK, "umi_errors.sam", true, true)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.CORRECT, report, 100, 1L);
            final DuplicateGroupIndex index = resolver.findDuplicateGroups();
            Assert.assertEquals(index.getGroups().size(), 1);
            Assert.assertEquals(index.getGroups().get(0).getReadGroupIds(), Arrays.asList("0000000001", "0000000002"));

            final DedupMetrics metrics = report.getMetrics();
            Assert.assertEquals(metrics.READ_GROUPS_WITH_UMI_ERROR, 2);
            Assert.assertEquals(metrics.READ_GROUPS_WITH_CORRECTED_UMI, 1);
            Assert.assertEquals(metrics.READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR, 0);
            Assert.assertEquals(metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 3);

            try (Transaction txn = stores.getDatabase().begin(false)) {
                Assert.assertEquals(stores.getUmiErrors().get(txn, "e2-GGCCTAAA^AGCTCTAG;0^0").getMates().get(0),
                        new UmiErrorRecord.MateUmiError(1, 1, "GGCCTAAT"));
                // two nearest UMIs: not corrected
                Assert.assertEquals(stores.getUmiErrors().get(txn, "e3-TAGGTACG^AGCTCTAG;0^0").getMates().get(0),
                        new UmiErrorRecord.MateUmiError(1, 2, null));
            }
            Assert.assertEquals(resolver.selectWinners(), 1);
        }
    }

    @Test
    public void testKeepUmiErrors() {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(StoreType.MEMORY, "umi_errors.sam", true, true)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.KEEP, report, 100, 1L);
            Assert.assertTrue(resolver.findDuplicateGroups().getGroups().isEmpty());
            Assert.assertEquals(report.getMetrics().READ_GROUPS_WITH_UMI_ERROR, 2);
            Assert.assertEquals(report.getMetrics().READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR, 0);
            Assert.assertEquals(report.getMetrics().UNIQUE_UMI_AND_LOCATION_COMBINATIONS, 4);
            Assert.assertEquals(report.getRejectsByDistance().get(1).getValue(), 0.0, 0.0);
        }
    }

    @Test
    public void testPartitionByUmiPair() {
        final DedupReport report = new DedupReport(UmiKit.BIOO.getUmiLength());
        try (DedupStores stores = buildStores(StoreType.MEMORY, "dups.sam", true, true);
             Transaction readTxn = stores.getDatabase().begin(false);
             BatchedTransaction writeTxn = new BatchedTransaction(stores.getDatabase(), 100)) {
            final DuplicateResolver resolver = new DuplicateResolver(stores, UmiKit.BIOO, UmiErrorPolicy.REJECT, report, 100, 1L);
            final List<List<String>> partitions = new ArrayList<>(resolver.partitionByUmiPair(readTxn, writeTxn,
                    Arrays.asList("0000000001", "0000000004", "0000000003")));
            Assert.assertEquals(partitions, Arrays.asList(
                    Arrays.asList("0000000001", "0000000003"),
                    Collections.singletonList("0000000004")));
            writeTxn.commit();
        }
    }
}
