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
import dupliganger.db.ItemCodec;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Records, for a ReadGroup at least one of whose UMIs is not a known UMI, how far each mate's UMI is from the
 * nearest known UMIs and, where a UMI was corrected, what it was corrected to.  Rendered into the SAM tags
 * {@code d1/d2} (distance), {@code n1/n2} (number of nearest known UMIs) and {@code c1/c2} (corrected UMI).
 */
public final class UmiErrorRecord {
    public static final String TAG_DISTANCE = "d";
    public static final String TAG_NUM_CANDIDATES = "n";
    public static final String TAG_CORRECTED_UMI = "c";

    private final List<MateUmiError> mates;

    public UmiErrorRecord(final List<MateUmiError> mates) {
        if (mates.isEmpty()) {
            throw new IllegalArgumentException("A UMI error record needs at least one mate.");
        }
        this.mates = Collections.unmodifiableList(new ArrayList<>(mates));
    }

    public List<MateUmiError> getMates() {
        return mates;
    }

    /** @return the largest UMI distance over the mates */
    public int getMaxDistance() {
        int max = 0;
        for (final MateUmiError mate : mates) max = Math.max(max, mate.getDistance());
        return max;
    }

    /**
     * @param lineIndex index of an alignment line within its ReadGroup; line j takes the tags of mate j mod mates
     * @return the tab separated SAM tags to append to that line
     */
    public String toSamTags(final int lineIndex) {
        final int mateIndex = lineIndex % mates.size();
        final MateUmiError mate = mates.get(mateIndex);
        final int mateNumber = mateIndex + 1;
        final StringBuilder tags = new StringBuilder()
                .append(TAG_DISTANCE).append(mateNumber).append(":i:").append(mate.getDistance())
                .append('\t')
                .append(TAG_NUM_CANDIDATES).append(mateNumber).append(":i:").append(mate.getNumCandidates());
        if (mate.getCorrectedUmi() != null) {
            tags.append('\t').append(TAG_CORRECTED_UMI).append(mateNumber).append(":Z:").append(mate.getCorrectedUmi());
        }
        return tags.toString();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return mates.equals(((UmiErrorRecord) o).mates);
    }

    @Override
    public int hashCode() {
        return mates.hashCode();
    }

    @Override
    public String toString() {
        return new Codec().encode(this);
    }

    /** One mate's UMI error. */
    public static final class MateUmiError {
        private final int distance;
        private final int numCandidates;
        private final String correctedUmi;

        public MateUmiError(final int distance, final int numCandidates, final String correctedUmi) {
            this.distance = distance;
            this.numCandidates = numCandidates;
            this.correctedUmi = correctedUmi;
        }

        public int getDistance() {
            return distance;
        }

        public int getNumCandidates() {
            return numCandidates;
        }

        /** @return the UMI this mate's UMI was corrected to, or null if it was not corrected */
        public String getCorrectedUmi() {
            return correctedUmi;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final MateUmiError that = (MateUmiError) o;
            return distance == that.distance &&
                    numCandidates == that.numCandidates &&
                    Objects.equals(correctedUmi, that.correctedUmi);
        }

        @Override
        public int hashCode() {
            return Objects.hash(distance, numCandidates, correctedUmi);
        }
    }

    /**
     * Stores a record as {@code distance,numCandidates,correctedUmi} per mate, mates separated by '^'.  An
     * uncorrected mate has an empty corrected UMI.
     */
    public static class Codec implements ItemCodec<UmiErrorRecord> {
        private static final char DELIM_MATE = '^';
        private static final char DELIM_FIELD = ',';

        @Override
        public String encode(final UmiErrorRecord record) {
            final StringBuilder builder = new StringBuilder();
            for (final MateUmiError mate : record.mates) {
                if (builder.length() > 0) builder.append(DELIM_MATE);
                builder.append(mate.distance).append(DELIM_FIELD)
                        .append(mate.numCandidates).append(DELIM_FIELD)
                        .append(mate.correctedUmi == null ? "" : mate.correctedUmi);
            }
            return builder.toString();
        }

        @Override
        public UmiErrorRecord decode(final String stored) {
            final List<MateUmiError> mates = new ArrayList<>(2);
            for (final String mate : StringUtils.split(stored, DELIM_MATE)) {
                final String[] fields = StringUtils.splitPreserveAllTokens(mate, DELIM_FIELD);
                if (fields.length != 3) {
                    throw new DupligangerException("Malformed stored UMI error record: " + stored);
                }
                try {
                    mates.add(new MateUmiError(Integer.parseInt(fields[0]), Integer.parseInt(fields[1]),
                            fields[2].isEmpty() ? null : fields[2]));
                } catch (final NumberFormatException e) {
                    throw new DupligangerException("Malformed stored UMI error record: " + stored, e);
                }
            }
            return new UmiErrorRecord(mates);
        }
    }
}
