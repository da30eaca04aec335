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

import java.util.function.Function;

/**
 * Functions converting a ReadGroup into the location key under which it is indexed, e.g.
 * {@code chr5:1000000:+,chr5:1000500:-}: one {@code rname:start:strand} entry per read, where start is the
 * soft-clip corrected 5' start of the read.  Two ReadGroups with the same key are duplicate candidates.
 */
public final class LocationKeys {
    public static final char DELIM_LOCATION = ',';
    public static final char DELIM_LOCATION_FIELD = ':';

    private LocationKeys() { }

    /**
     * Location key corrected for soft clipping and for the 5' quality trimming recorded in the read name annotation.
     *
     * @throws HardClippingNotSupportedException if any read of the group is hard clipped
     */
    public static String toLocationKeyWith5pTrimming(final ReadGroup readGroup) {
        // read names (and hence 5' trims) are identical within a read group
        final ReadNameAnnotation annotation = ReadNameAnnotation.parse(readGroup.getName());
        final StringBuilder key = new StringBuilder();
        for (int i = 0; i < readGroup.size(); i++) {
            final Read read = readGroup.get(i);
            final int syntheticStart = AlignmentSpan.parse(read.getPos(), read.getStrand(), read.getCigar()).getSyntheticStart();
            final int trim = annotation.getFivePrimeTrim(i);
            final int trimmedStart = read.getStrand() == Strand.FORWARD ? syntheticStart - trim : syntheticStart + trim;
            appendLocation(key, read, trimmedStart);
        }
        return key.toString();
    }

    /**
     * Location key corrected for soft clipping only.
     *
     * @throws HardClippingNotSupportedException if any read of the group is hard clipped
     */
    public static String toLocationKeyNo5pTrim(final ReadGroup readGroup) {
        final StringBuilder key = new StringBuilder();
        for (final Read read : readGroup) {
            appendLocation(key, read, AlignmentSpan.parse(read.getPos(), read.getStrand(), read.getCigar()).getSyntheticStart());
        }
        return key.toString();
    }

    /**
     * @return the key function for reads that were, or were not, 5' quality trimmed upstream
     */
    public static Function<ReadGroup, String> forTrimming(final boolean fivePrimeTrimmed) {
        return fivePrimeTrimmed ? LocationKeys::toLocationKeyWith5pTrimming : LocationKeys::toLocationKeyNo5pTrim;
    }

    private static void appendLocation(final StringBuilder key, final Read read, final int start) {
        if (key.length() > 0) key.append(DELIM_LOCATION);
        key.append(read.getRname()).append(DELIM_LOCATION_FIELD).append(start).append(DELIM_LOCATION_FIELD).append(read.getStrand());
    }
}
