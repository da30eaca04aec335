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
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * An alignment line of a SAM file, reduced to the fields needed to locate it: QNAME, FLAG, RNAME, POS, MAPQ and CIGAR.
 * The remaining fields are never stored; the reconciliation pass re-reads the original lines instead.
 */
public final class Read {
    public static final int READ_REVERSE_STRAND_FLAG = 0x10;
    /** A 'PCR or optical duplicate' is marked with 0x400 in the FLAG field of SAM files. */
    public static final int DUPLICATE_READ_FLAG = 0x400;

    public static final char FIELD_DELIMITER = '\t';
    static final int NUM_STORED_FIELDS = 6;

    private final String qname;
    private final int flag;
    private final String rname;
    private final int pos;
    private final String mapq;
    private final String cigar;

    public Read(final String qname, final int flag, final String rname, final int pos, final String mapq, final String cigar) {
        this.qname = qname;
        this.flag = flag;
        this.rname = rname;
        this.pos = pos;
        this.mapq = mapq;
        this.cigar = cigar;
    }

    /**
     * Parses a SAM alignment line (or the stored form of a Read, which is its first six fields).
     *
     * @throws DupligangerException if the line has too few fields or a non-numeric FLAG or POS
     */
    public static Read parse(final String line) {
        // the unstored fields stay joined in a trailing token
        final String[] fields = StringUtils.splitPreserveAllTokens(line, String.valueOf(FIELD_DELIMITER), NUM_STORED_FIELDS + 1);
        if (fields.length < NUM_STORED_FIELDS) {
            throw new DupligangerException("Malformed SAM alignment line, expected at least " + NUM_STORED_FIELDS +
                    " tab-separated fields: " + line);
        }
        try {
            return new Read(fields[0], Integer.parseInt(fields[1]), fields[2], Integer.parseInt(fields[3]), fields[4], fields[5]);
        } catch (final NumberFormatException e) {
            throw new DupligangerException("Malformed FLAG or POS in SAM alignment line: " + line, e);
        }
    }

    public String getQname() { return qname; }

    public int getFlag() { return flag; }

    public String getRname() { return rname; }

    public int getPos() { return pos; }

    public String getMapq() { return mapq; }

    public String getCigar() { return cigar; }

    public Strand getStrand() {
        return Strand.fromFlag(flag);
    }

    /**
     * @return the stored form of this read: its six fields joined by tabs.
     */
    @Override
    public String toString() {
        return String.join(String.valueOf(FIELD_DELIMITER), qname, Integer.toString(flag), rname, Integer.toString(pos), mapq, cigar);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Read read = (Read) o;
        return flag == read.flag &&
                pos == read.pos &&
                qname.equals(read.qname) &&
                rname.equals(read.rname) &&
                mapq.equals(read.mapq) &&
                cigar.equals(read.cigar);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qname, flag, rname, pos, mapq, cigar);
    }
}
