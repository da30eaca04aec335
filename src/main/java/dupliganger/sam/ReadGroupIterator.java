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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Parses the alignment lines of a SAM file into ReadGroups, one per run of lines sharing a QNAME.
 */
public class ReadGroupIterator implements Iterator<ReadGroup> {
    private final SamLineGroupIterator groups;

    public ReadGroupIterator(final Iterator<String> alignmentLines) {
        this.groups = new SamLineGroupIterator(alignmentLines);
    }

    @Override
    public boolean hasNext() {
        return groups.hasNext();
    }

    @Override
    public ReadGroup next() {
        final List<String> lines = groups.next();
        final List<Read> reads = new ArrayList<>(lines.size());
        for (final String line : lines) {
            reads.add(Read.parse(line));
        }
        return new ReadGroup(reads);
    }
}
