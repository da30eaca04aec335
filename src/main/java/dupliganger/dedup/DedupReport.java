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

import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.Histogram;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The metrics of a run and the two histograms of UMI errors by Hamming distance: all ReadGroups with a UMI error,
 * binned by the larger distance of their mates, and the subset that was rejected.
 */
public class DedupReport {
    public static final String UMI_ERROR_BIN_LABEL = "umi_distance";
    public static final String UMI_ERROR_HISTOGRAM = "read_groups_with_umi_error";
    public static final String UMI_REJECT_HISTOGRAM = "read_groups_rejected_due_to_umi_error";

    private final DedupMetrics metrics = new DedupMetrics();
    private final Histogram<Integer> umiErrorsByDistance = new Histogram<>(UMI_ERROR_BIN_LABEL, UMI_ERROR_HISTOGRAM);
    private final Histogram<Integer> rejectsByDistance = new Histogram<>(UMI_ERROR_BIN_LABEL, UMI_REJECT_HISTOGRAM);

    public DedupReport(final int maxUmiDistance) {
        for (int distance = 1; distance <= maxUmiDistance; distance++) {
            umiErrorsByDistance.increment(distance, 0);
            rejectsByDistance.increment(distance, 0);
        }
    }

    public DedupMetrics getMetrics() {
        return metrics;
    }

    public Histogram<Integer> getUmiErrorsByDistance() {
        return umiErrorsByDistance;
    }

    public Histogram<Integer> getRejectsByDistance() {
        return rejectsByDistance;
    }

    public void recordUmiError(final int distance) {
        metrics.READ_GROUPS_WITH_UMI_ERROR++;
        umiErrorsByDistance.increment(distance);
    }

    public void recordReject(final int distance) {
        metrics.READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR++;
        rejectsByDistance.increment(distance);
    }

    /** @return every count of the report, keyed by name, in a fixed order */
    public Map<String, Long> toCounts() {
        final Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("num_read_groups", metrics.READ_GROUPS);
        counts.put("num_hard_clipped_read_groups", metrics.HARD_CLIPPED_READ_GROUPS);
        counts.put("num_locations", metrics.LOCATIONS);
        counts.put("num_unique_umi_and_location_combinations", metrics.UNIQUE_UMI_AND_LOCATION_COMBINATIONS);
        counts.put("num_dup_groups", metrics.DUP_GROUPS);
        counts.put("num_duplicate_read_groups", metrics.DUPLICATE_READ_GROUPS);
        counts.put("num_read_groups_with_umi_error", metrics.READ_GROUPS_WITH_UMI_ERROR);
        counts.put("num_read_groups_with_corrected_umi", metrics.READ_GROUPS_WITH_CORRECTED_UMI);
        counts.put("num_read_groups_rejected_due_to_umi_error", metrics.READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR);
        for (final Integer distance : umiErrorsByDistance.keySet()) {
            counts.put("num_read_groups_with_umi_error_dist" + distance, (long) umiErrorsByDistance.get(distance).getValue());
        }
        for (final Integer distance : rejectsByDistance.keySet()) {
            counts.put("num_read_groups_rejected_due_to_umi_error_dist" + distance, (long) rejectsByDistance.get(distance).getValue());
        }
        return counts;
    }

    /** Logs each count as a {@code key: value} line. */
    public void log(final Log log) {
        for (final Map.Entry<String, Long> count : toCounts().entrySet()) {
            log.info(count.getKey() + ": " + count.getValue());
        }
    }

    /** Writes the metrics and both histograms to a metrics file. */
    public void write(final MetricsFile<DedupMetrics, Integer> file, final File output) {
        file.addMetric(metrics);
        file.addHistogram(umiErrorsByDistance);
        file.addHistogram(rejectsByDistance);
        file.write(output);
    }
}
