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

import dupliganger.cmdline.programgroups.ReadDataManipulationProgramGroup;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

/**
 * Runs only the first pass of {@link Dedup}: reads the input into the read group and location stores, optionally
 * dumping them.  The database file is kept by default, so that it can be inspected.
 */
@CommandLineProgramProperties(
        summary = BuildReadAndLocationDbs.USAGE_SUMMARY +
                "The read group store maps read group ids to the alignments of each read name; the location store maps " +
                "each corrected location to the ids of the read groups there.  Useful for debugging and for inspecting " +
                "how reads are located.",
        oneLineSummary = BuildReadAndLocationDbs.USAGE_SUMMARY,
        programGroup = ReadDataManipulationProgramGroup.class
)
public class BuildReadAndLocationDbs extends AbstractDedupCommandLineProgram {
    static final String USAGE_SUMMARY = "Builds the read group and location stores of an alignment file. ";

    private final Log log = Log.getInstance(BuildReadAndLocationDbs.class);

    public BuildReadAndLocationDbs() {
        KEEP_DB = true;
    }

    @Override
    protected int doWork() {
        assertPrerequisites();
        final DedupMetrics metrics = new DedupMetrics();
        try (DedupStores stores = openStores()) {
            buildReadAndLocationDbs(stores, metrics);
            dumpReadAndLocationDbs(stores);
        }
        log.info("num_read_groups: " + metrics.READ_GROUPS);
        log.info("num_hard_clipped_read_groups: " + metrics.HARD_CLIPPED_READ_GROUPS);
        cleanUpDatabase();
        return 0;
    }
}
