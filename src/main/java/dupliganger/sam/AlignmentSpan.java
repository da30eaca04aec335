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
import htsjdk.samtools.Cigar;
import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;
import htsjdk.samtools.TextCigarCodec;

import java.util.Objects;

/**
 * The real and synthetic (soft-clip corrected) extent of an alignment, oriented 5' to 3' along the read's strand.
 * For a reverse strand alignment {@code start > end}, so that {@link #getSyntheticStart()} is always the 5' origin
 * of the fragment, comparable across strands.
 */
public final class AlignmentSpan {
    private final int syntheticStart;
    private final int start;
    private final int end;
    private final int syntheticEnd;

    public AlignmentSpan(final int syntheticStart, final int start, final int end, final int syntheticEnd) {
        this.syntheticStart = syntheticStart;
        this.start = start;
        this.end = end;
        this.syntheticEnd = syntheticEnd;
    }

    /**
     * Parses a CIGAR string and computes the span of the alignment.
     *
     * @param pos    SAM 'POS', the leftmost mapped position
     * @param strand strand of the alignment
     * @param cigar  CIGAR string, or "*" if unavailable
     * @throws HardClippingNotSupportedException if the CIGAR contains an H operator
     * @throws DupligangerException              if the CIGAR is malformed
     */
    public static AlignmentSpan parse(final int pos, final Strand strand, final String cigar) {
        int clippedLeft = 0;
        int clippedRight = 0;
        int alignmentLength = 0;
        boolean firstElement = true;

        for (final CigarElement element : decode(cigar)) {
            final CigarOperator operator = element.getOperator();
            if (operator == CigarOperator.H) {
                throw new HardClippingNotSupportedException("Hard clipping is not supported. cigar: " + cigar +
                        ", left pos: " + pos + ", strand: " + strand);
            }
            if (operator == CigarOperator.S) {
                if (firstElement) {
                    clippedLeft = element.getLength();
                } else {
                    clippedRight = element.getLength();
                }
            } else if (operator.consumesReferenceBases()) {
                // M, =, X, D and N
                alignmentLength += element.getLength();
            }
            firstElement = false;
        }

        if (strand == Strand.FORWARD) {
            final int end = pos + alignmentLength - 1;
            return new AlignmentSpan(pos - clippedLeft, pos, end, end + clippedRight);
        } else {
            final int start = pos + alignmentLength - 1;
            return new AlignmentSpan(start + clippedRight, start, pos, pos - clippedLeft);
        }
    }

    private static Cigar decode(final String cigar) {
        // the codec runs off the end of a CIGAR whose last length has no operator
        if (!cigar.isEmpty() && Character.isDigit(cigar.charAt(cigar.length() - 1))) {
            throw new DupligangerException("CIGAR string ends without an operator: " + cigar);
        }
        try {
            return TextCigarCodec.decode(cigar);
        } catch (final IllegalArgumentException e) {
            throw new DupligangerException("Malformed CIGAR string " + cigar, e);
        }
    }

    /** @return the 5' start of the alignment, extended by any 5' soft clipping */
    public int getSyntheticStart() { return syntheticStart; }

    public int getStart() { return start; }

    public int getEnd() { return end; }

    /** @return the 3' end of the alignment, extended by any 3' soft clipping */
    public int getSyntheticEnd() { return syntheticEnd; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AlignmentSpan that = (AlignmentSpan) o;
        return syntheticStart == that.syntheticStart && start == that.start && end == that.end && syntheticEnd == that.syntheticEnd;
    }

    @Override
    public int hashCode() {
        return Objects.hash(syntheticStart, start, end, syntheticEnd);
    }

    @Override
    public String toString() {
        return "(" + syntheticStart + ", " + start + ", " + end + ", " + syntheticEnd + ")";
    }
}
