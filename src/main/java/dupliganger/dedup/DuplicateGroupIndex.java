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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory index from ReadGroup id to the DuplicateGroup containing it.  Only ReadGroups that have duplicates
 * are indexed, so the index stays small relative to the input.
 */
public class DuplicateGroupIndex {
    private final Map<String, DuplicateGroup> groupsByReadGroupId = new HashMap<>();

    /**
     * Files a set of ReadGroup ids as one DuplicateGroup.  If some of them already belong to a DuplicateGroup the
     * others join it.
     *
     * @throws DupligangerException if the ids already belong to more than one DuplicateGroup
     */
    public void add(final Collection<String> readGroupIds) {
        final Set<DuplicateGroup> existing = Collections.newSetFromMap(new IdentityHashMap<>());
        for (final String readGroupId : readGroupIds) {
            final DuplicateGroup group = groupsByReadGroupId.get(readGroupId);
            if (group != null) existing.add(group);
        }
        if (existing.size() > 1) {
            throw new DupligangerException("ReadGroups " + readGroupIds + " are already members of " + existing.size() +
                    " distinct duplicate groups: " + existing);
        }

        final DuplicateGroup group = existing.isEmpty() ? new DuplicateGroup() : existing.iterator().next();
        for (final String readGroupId : readGroupIds) {
            group.add(readGroupId);
            groupsByReadGroupId.put(readGroupId, group);
        }
    }

    /** @return the DuplicateGroup containing the ReadGroup, or null */
    public DuplicateGroup get(final String readGroupId) {
        return groupsByReadGroupId.get(readGroupId);
    }

    /** @return the distinct DuplicateGroups, ordered by their smallest member */
    public List<DuplicateGroup> getGroups() {
        final Set<DuplicateGroup> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(groupsByReadGroupId.values());
        final List<DuplicateGroup> groups = new ArrayList<>(distinct);
        Collections.sort(groups);
        return groups;
    }

    public int numReadGroups() {
        return groupsByReadGroupId.size();
    }

    /** @return one {@code readGroupId: [members]} line per indexed ReadGroup, sorted */
    public List<String> dump() {
        final List<String> lines = new ArrayList<>(groupsByReadGroupId.size());
        for (final Map.Entry<String, DuplicateGroup> entry : groupsByReadGroupId.entrySet()) {
            lines.add(entry.getKey() + ": " + entry.getValue());
        }
        Collections.sort(lines);
        return lines;
    }
}
