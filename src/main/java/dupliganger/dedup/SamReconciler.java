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
import dupliganger.db.Transaction;
import dupliganger.sam.Read;
import dupliganger.sam.SamLineGroupIterator;
import dupliganger.sam.SamTextSource;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Final pass over the input: every ReadGroup is copied to the outputs its fate calls for.
 * <ul>
 *     <li>duplicates are flagged 0x400 and go to the flagged and duplicates-only outputs</li>
 *     <li>otherwise, ReadGroups with a UMI error go to the UMI error output when UMI errors are rejected</li>
 *     <li>everything else goes to the deduplicated and flagged outputs</li>
 * </ul>
 * Lines of ReadGroups with a UMI error carry the UMI error tags.
 */
public class SamReconciler {
    private static final Log log = Log.getInstance(SamReconciler.class);

    private final DedupStores stores;
    private final UmiErrorPolicy umiErrorPolicy;
    private final boolean writeHeaders;
    private final String programRecord;

    /**
     * @param programRecord the @PG line added to the header of every SAM output
     */
    public SamReconciler(final DedupStores stores, final UmiErrorPolicy umiErrorPolicy, final boolean writeHeaders,
                         final String programRecord) {
        this.stores = stores;
        this.umiErrorPolicy = umiErrorPolicy;
        this.writeHeaders = writeHeaders;
        this.programRecord = programRecord;
    }

    /** Builds the @PG header line for this program. */
    public static String buildProgramRecord(final String programName, final String version, final String commandLine) {
        return "@PG\tID:" + programName + "\tPN:" + programName + "\tVN:" + version + "\tCL:" + commandLine;
    }

    /** @return the alignment line with the duplicate bit set in its FLAG */
    public static String flagAsDuplicate(final String line) {
        final int flagStart = line.indexOf(Read.FIELD_DELIMITER) + 1;
        final int flagEnd = line.indexOf(Read.FIELD_DELIMITER, flagStart);
        if (flagStart == 0 || flagEnd < 0) {
            throw new DupligangerException("Malformed SAM alignment line: " + line);
        }
        try {
            final int flag = Integer.parseInt(line.substring(flagStart, flagEnd)) | Read.DUPLICATE_READ_FLAG;
            return line.substring(0, flagStart) + flag + line.substring(flagEnd);
        } catch (final NumberFormatException e) {
            throw new DupligangerException("Malformed FLAG in SAM alignment line: " + line, e);
        }
    }

    public void reconcile(final SamTextSource source, final DedupOutputs outputs) {
        final BufferedWriter dedupped = outputs.get(DedupOutput.DEDUPPED);
        final BufferedWriter flagged = outputs.get(DedupOutput.FLAGGED);
        final BufferedWriter duplicates = outputs.get(DedupOutput.DUPLICATES);
        final BufferedWriter umiErrors = outputs.get(DedupOutput.UMI_ERRORS);
        final List<BufferedWriter> samOutputs = Arrays.asList(dedupped, flagged, duplicates, umiErrors);
        final ProgressLogger progress = new ProgressLogger(log, 1000000, "Wrote", "read groups");

        try {
            if (writeHeaders) {
                writeHeader(source.getHeaderLines(), samOutputs);
            }

            try (Transaction txn = stores.getDatabase().begin(false)) {
                final SamLineGroupIterator groups = new SamLineGroupIterator(source.iterator());
                while (groups.hasNext()) {
                    List<String> lines = groups.next();
                    final String name = SamLineGroupIterator.getQname(lines.get(0));

                    final UmiErrorRecord umiError = stores.getUmiErrors().get(txn, name);
                    if (umiError != null) {
                        lines = withUmiErrorTags(lines, umiError);
                    }

                    if (stores.getLosers().get(txn, name) != null) {
                        for (final String line : lines) {
                            final String flaggedLine = flagAsDuplicate(line);
                            writeLine(flagged, flaggedLine);
                            writeLine(duplicates, flaggedLine);
                        }
                    } else if (umiError != null && umiErrorPolicy == UmiErrorPolicy.REJECT) {
                        for (final String line : lines) {
                            writeLine(umiErrors, line);
                        }
                    } else {
                        for (final String line : lines) {
                            writeLine(dedupped, line);
                            writeLine(flagged, line);
                        }
                    }
                    progress.record(name, 0);
                }
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error writing SAM outputs", e);
        }
    }

    private void writeHeader(final List<String> headerLines, final List<BufferedWriter> samOutputs) throws IOException {
        for (final BufferedWriter out : samOutputs) {
            if (headerLines.isEmpty()) {
                writeLine(out, programRecord);
            }
            for (int i = 0; i < headerLines.size(); i++) {
                writeLine(out, headerLines.get(i));
                if (i == 0) writeLine(out, programRecord);
            }
        }
    }

    private static List<String> withUmiErrorTags(final List<String> lines, final UmiErrorRecord umiError) {
        final List<String> tagged = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            tagged.add(lines.get(i) + Read.FIELD_DELIMITER + umiError.toSamTags(i));
        }
        return tagged;
    }

    private static void writeLine(final BufferedWriter out, final String line) throws IOException {
        out.write(line);
        out.newLine();
    }
}
