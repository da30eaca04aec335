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

import dupliganger.db.ObjectStore;
import dupliganger.db.Transaction;
import dupliganger.sam.Read;
import dupliganger.sam.ReadGroup;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.List;

/**
 * Writes the SAM-like duplicate group file: the stored fields of every read of every duplicate group, one read per
 * line, with a blank line between groups.
 */
public class DuplicateGroupFileWriter {
    private final ObjectStore<ReadGroup> readGroups;

    public DuplicateGroupFileWriter(final ObjectStore<ReadGroup> readGroups) {
        this.readGroups = readGroups;
    }

    public void write(final Transaction txn, final List<DuplicateGroup> groups, final BufferedWriter out) {
        try {
            boolean first = true;
            for (final DuplicateGroup group : groups) {
                if (!first) out.newLine();
                first = false;
                for (final String readGroupId : group.getReadGroupIds()) {
                    for (final Read read : readGroups.get(txn, readGroupId)) {
                        out.write(read.toString());
                        out.newLine();
                    }
                }
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error writing duplicate group file", e);
        }
    }
}
