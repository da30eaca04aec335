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
import dupliganger.db.BatchedTransaction;
import dupliganger.db.Transaction;
import dupliganger.sam.ReadGroup;
import dupliganger.sam.ReadNameAnnotation;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Finds the duplicate groups among the stored ReadGroups and picks the one ReadGroup of each group to keep.
 *
 * Every location holding more than one ReadGroup is examined: the UMIs of each ReadGroup there are compared against
 * the kit, errors are recorded (and, depending on the {@link UmiErrorPolicy}, corrected or rejected), and the
 * ReadGroups are partitioned by UMI pair.  Each partition with more than one member is a duplicate group.
 *
 * Winners are then chosen uniformly at random with a generator seeded immediately before selection, so the choice
 * is reproducible for a given input, seed and configuration.
 */
public class DuplicateResolver {
    private static final Log log = Log.getInstance(DuplicateResolver.class);

    private static final char DELIM_UMI_PAIR = ',';

    private final DedupStores stores;
    private final UmiKit kit;
    private final UmiErrorPolicy umiErrorPolicy;
    private final DedupReport report;
    private final int batchSize;
    private final long randomSeed;
    private final DuplicateGroupIndex duplicateGroups = new DuplicateGroupIndex();
    private final Random random = new Random();

    public DuplicateResolver(final DedupStores stores, final UmiKit kit, final UmiErrorPolicy umiErrorPolicy,
                             final DedupReport report, final int batchSize, final long randomSeed) {
        this.stores = stores;
        this.kit = kit;
        this.umiErrorPolicy = umiErrorPolicy;
        this.report = report;
        this.batchSize = batchSize;
        this.randomSeed = randomSeed;
    }

    public DuplicateGroupIndex getDuplicateGroups() {
        return duplicateGroups;
    }

    /**
     * Scans the location index once, recording UMI errors and building the duplicate group index.
     */
    public DuplicateGroupIndex findDuplicateGroups() {
        final DedupMetrics metrics = report.getMetrics();
        final ProgressLogger progress = new ProgressLogger(log, 1000000, "Examined", "locations");

        try (Transaction readTxn = stores.getDatabase().begin(false);
             BatchedTransaction writeTxn = new BatchedTransaction(stores.getDatabase(), batchSize)) {
            final Iterator<Map.Entry<String, List<String>>> locations = stores.getLocations().iterator(readTxn);
            while (locations.hasNext()) {
                final Map.Entry<String, List<String>> location = locations.next();
                metrics.LOCATIONS++;
                progress.record(location.getKey(), 0);

                final List<String> readGroupIds = location.getValue();
                if (readGroupIds.size() == 1) {
                    metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS++;
                    continue;
                }

                final Collection<List<String>> partitions = partitionByUmiPair(readTxn, writeTxn, readGroupIds);
                metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS += partitions.size();
                for (final List<String> partition : partitions) {
                    if (partition.size() > 1) {
                        duplicateGroups.add(partition);
                        metrics.DUP_GROUPS++;
                    }
                }
            }
            writeTxn.commit();
        }

        log.info("Found " + metrics.DUP_GROUPS + " duplicate groups at " + metrics.LOCATIONS + " locations.");
        return duplicateGroups;
    }

    /**
     * Partitions the ReadGroups at one location by their UMI pair, after applying the UMI error policy.
     */
    Collection<List<String>> partitionByUmiPair(final Transaction readTxn, final BatchedTransaction writeTxn,
                                                final List<String> readGroupIds) {
        final Map<String, List<String>> byUmiPair = new LinkedHashMap<>();

        for (final String readGroupId : readGroupIds) {
            final ReadGroup readGroup = stores.getReadGroups().get(readTxn, readGroupId);
            if (readGroup == null) {
                throw new DupligangerException("Location index refers to ReadGroup " + readGroupId +
                        ", which is not in the read group store.");
            }
            final List<String> umis = new ArrayList<>(ReadNameAnnotation.parse(readGroup.getName()).getUmis());
            final List<UmiMatch> matches = new ArrayList<>(umis.size());
            boolean hasError = false;
            boolean correctable = true;
            for (final String umi : umis) {
                final UmiMatch match = kit.findNearest(umi);
                matches.add(match);
                hasError |= !match.isExact();
                correctable &= match.isCorrectable();
            }

            if (hasError) {
                final boolean correct = umiErrorPolicy == UmiErrorPolicy.CORRECT && correctable;
                final List<UmiErrorRecord.MateUmiError> mates = new ArrayList<>(matches.size());
                boolean corrected = false;
                for (int i = 0; i < matches.size(); i++) {
                    final UmiMatch match = matches.get(i);
                    final String correction = correct ? match.getCorrection() : null;
                    if (correction != null) {
                        umis.set(i, correction);
                        corrected = true;
                    }
                    mates.add(new UmiErrorRecord.MateUmiError(match.getDistance(), match.getCandidates().size(), correction));
                }
                final UmiErrorRecord record = new UmiErrorRecord(mates);
                stores.getUmiErrors().put(writeTxn.get(), readGroup.getName(), record);
                writeTxn.recordWritten();
                report.recordUmiError(record.getMaxDistance());
                if (corrected) report.getMetrics().READ_GROUPS_WITH_CORRECTED_UMI++;

                if (umiErrorPolicy == UmiErrorPolicy.REJECT) {
                    report.recordReject(record.getMaxDistance());
                    continue;
                }
            }

            byUmiPair.computeIfAbsent(String.join(String.valueOf(DELIM_UMI_PAIR), umis), k -> new ArrayList<>())
                    .add(readGroupId);
        }
        return byUmiPair.values();
    }

    /**
     * Picks one winner per duplicate group and records every other member in the loser store.  Groups are taken in
     * order of their smallest member and members in ascending order.
     *
     * @return the number of losers
     */
    public long selectWinners() {
        random.setSeed(randomSeed);
        long numLosers = 0;

        try (Transaction readTxn = stores.getDatabase().begin(false);
             BatchedTransaction writeTxn = new BatchedTransaction(stores.getDatabase(), batchSize)) {
            for (final DuplicateGroup group : duplicateGroups.getGroups()) {
                final List<String> members = group.getReadGroupIds();
                final int winner = random.nextInt(members.size());
                for (int i = 0; i < members.size(); i++) {
                    if (i == winner) continue;
                    final ReadGroup loser = stores.getReadGroups().get(readTxn, members.get(i));
                    stores.getLosers().put(writeTxn.get(), loser.getName(), Collections.singletonList(DedupStores.LOSER_SENTINEL));
                    numLosers++;
                }
                writeTxn.recordWritten();
            }
            writeTxn.commit();
        }

        report.getMetrics().DUPLICATE_READ_GROUPS = numLosers;
        log.info("Marked " + numLosers + " read groups as duplicates.");
        return numLosers;
    }
}
