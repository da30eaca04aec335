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

import htsjdk.samtools.metrics.MetricBase;

/**
 * Counts collected over one deduplication run.
 */
public class DedupMetrics extends MetricBase {
    /** The number of ReadGroups (read pairs, or single reads) in the input. */
    public long READ_GROUPS;

    /** The number of ReadGroups that were not indexed by location because they were hard clipped. */
    public long HARD_CLIPPED_READ_GROUPS;

    /** The number of distinct locations. */
    public long LOCATIONS;

    /** The number of distinct combinations of location and UMI pair. */
    public long UNIQUE_UMI_AND_LOCATION_COMBINATIONS;

    /** The number of duplicate groups, that is, location and UMI pair combinations with more than one ReadGroup. */
    public long DUP_GROUPS;

    /** The number of ReadGroups removed as duplicates. */
    public long DUPLICATE_READ_GROUPS;

    /** The number of ReadGroups with a UMI that is not a known UMI of the kit. */
    public long READ_GROUPS_WITH_UMI_ERROR;

    /** The number of ReadGroups rejected because of a UMI error. */
    public long READ_GROUPS_REJECTED_DUE_TO_UMI_ERROR;

    /** The number of ReadGroups whose UMIs were corrected. */
    public long READ_GROUPS_WITH_CORRECTED_UMI;
}
