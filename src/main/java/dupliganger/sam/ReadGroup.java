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

package dupliganger.sam;

import dupliganger.DupligangerException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The alignment lines of a SAM file that all share one read name: a read pair, a single-end read, or all of the
 * alignments of a multi-mapped read (pair).
 */
public final class ReadGroup implements Iterable<Read> {
    /** Separates the reads of a ReadGroup in its stored form.  ASCII 30, "record separator". */
    public static final char READ_DELIMITER = (char) 30;

    private final List<Read> reads;

    public ReadGroup(final List<Read> reads) {
        if (reads.isEmpty()) {
            throw new IllegalArgumentException("A ReadGroup must contain at least one read.");
        }
        final String qname = reads.get(0).getQname();
        for (final Read read : reads) {
            if (!qname.equals(read.getQname())) {
                throw new DupligangerException("All reads in a ReadGroup must share one read name, found " +
                        qname + " and " + read.getQname());
            }
        }
        this.reads = Collections.unmodifiableList(new ArrayList<>(reads));
    }

    /**
     * Loads a ReadGroup from its stored form.
     */
    public static ReadGroup parse(final String stored) {
        final List<Read> reads = new ArrayList<>(2);
        int start = 0;
        int end;
        while ((end = stored.indexOf(READ_DELIMITER, start)) >= 0) {
            reads.add(Read.parse(stored.substring(start, end)));
            start = end + 1;
        }
        reads.add(Read.parse(stored.substring(start)));
        return new ReadGroup(reads);
    }

    /** @return the qname shared by every read of this group */
    public String getName() {
        return reads.get(0).getQname();
    }

    public List<Read> getReads() {
        return reads;
    }

    public Read get(final int index) {
        return reads.get(index);
    }

    public int size() {
        return reads.size();
    }

    @Override
    public Iterator<Read> iterator() {
        return reads.iterator();
    }

    /**
     * @return the stored form of this group: the stored form of each read, joined by {@link #READ_DELIMITER}.
     */
    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        for (final Read read : reads) {
            if (builder.length() > 0) builder.append(READ_DELIMITER);
            builder.append(read);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return reads.equals(((ReadGroup) o).reads);
    }

    @Override
    public int hashCode() {
        return reads.hashCode();
    }
}
