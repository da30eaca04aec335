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

import htsjdk.samtools.util.PeekableIterator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Groups consecutive SAM alignment lines that share a QNAME.  The input must have the alignments of a read (pair)
 * adjacent to one another, as aligners emit them or as a query-name sort leaves them.
 */
public class SamLineGroupIterator implements Iterator<List<String>> {
    private final PeekableIterator<String> lines;

    public SamLineGroupIterator(final Iterator<String> lines) {
        this.lines = new PeekableIterator<>(lines);
    }

    /** @return the QNAME field of a SAM alignment line */
    public static String getQname(final String line) {
        final int tab = line.indexOf(Read.FIELD_DELIMITER);
        return tab < 0 ? line : line.substring(0, tab);
    }

    @Override
    public boolean hasNext() {
        return lines.hasNext();
    }

    @Override
    public List<String> next() {
        if (!hasNext()) throw new NoSuchElementException();
        final String qname = getQname(lines.peek());
        final List<String> group = new ArrayList<>(2);

        while (lines.hasNext() && getQname(lines.peek()).equals(qname)) {
            group.add(lines.next());
        }
        return group;
    }
}
