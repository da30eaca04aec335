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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The ids of ReadGroups that share a location and a (possibly corrected) UMI pair, and hence are copies of one
 * original molecule.  ReadGroup ids are zero padded, so their natural order is their numeric order.
 * DuplicateGroups order by their smallest member.
 */
public class DuplicateGroup implements Comparable<DuplicateGroup> {
    private final SortedSet<String> readGroupIds = new TreeSet<>();

    public DuplicateGroup() { }

    public DuplicateGroup(final Collection<String> readGroupIds) {
        this.readGroupIds.addAll(readGroupIds);
    }

    public void add(final String readGroupId) {
        readGroupIds.add(readGroupId);
    }

    public int size() {
        return readGroupIds.size();
    }

    /** @return the member ids in ascending order */
    public List<String> getReadGroupIds() {
        return Collections.unmodifiableList(new ArrayList<>(readGroupIds));
    }

    public String getFirst() {
        return readGroupIds.first();
    }

    @Override
    public int compareTo(final DuplicateGroup that) {
        if (this.readGroupIds.isEmpty() || that.readGroupIds.isEmpty()) {
            return Integer.compare(this.readGroupIds.size(), that.readGroupIds.size());
        }
        return this.getFirst().compareTo(that.getFirst());
    }

    @Override
    public String toString() {
        return readGroupIds.toString();
    }
}
