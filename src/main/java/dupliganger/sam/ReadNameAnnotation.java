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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The UMI and 5'-trim annotation carried in a read name by the upstream annotation steps, e.g.
 * <pre>
 *     D00597:180:C7NMDANXX:6:1101:1184:39633-GGCCTAAT^AGCTCTAG;2^0
 * </pre>
 * where GGCCTAAT and AGCTCTAG are the UMIs of read 1 and read 2, and 2 and 0 are the number of bases
 * quality-trimmed from their 5' ends.
 */
public final class ReadNameAnnotation {
    /** Separates a read name from its annotation. */
    public static final char DELIM_ANNO = '-';
    /** Separates the values of the two reads of a pair. */
    public static final char DELIM_ANNO_READ_PAIR = '^';
    /** Separates annotation records of different types. */
    public static final char DELIM_ANNO_TYPE = ';';

    private final String readName;
    private final List<String> umis;
    private final List<Integer> fivePrimeTrims;

    ReadNameAnnotation(final String readName, final List<String> umis, final List<Integer> fivePrimeTrims) {
        this.readName = readName;
        this.umis = Collections.unmodifiableList(umis);
        this.fivePrimeTrims = Collections.unmodifiableList(fivePrimeTrims);
    }

    /**
     * @throws DupligangerException if the qname does not carry a UMI annotation, has an empty UMI or 5' trim, or has a
     *                              different number of UMIs and 5' trims
     */
    public static ReadNameAnnotation parse(final String qname) {
        final int annoStart = qname.lastIndexOf(DELIM_ANNO);
        if (annoStart <= 0) {
            throw new DupligangerException("Read name is not annotated with UMIs and 5' trims: " + qname);
        }
        final String[] records = StringUtils.splitPreserveAllTokens(qname.substring(annoStart + 1), DELIM_ANNO_TYPE);
        if (records.length < 1 || records[0].isEmpty()) {
            throw new DupligangerException("Read name annotation must contain UMIs: " + qname);
        }
        final List<String> umis = new ArrayList<>(2);
        for (final String umi : StringUtils.splitPreserveAllTokens(records[0], DELIM_ANNO_READ_PAIR)) {
            if (umi.isEmpty()) {
                throw new DupligangerException("Empty UMI in read name " + qname);
            }
            umis.add(umi);
        }
        final List<Integer> trims = new ArrayList<>(2);
        if (records.length > 1) {
            for (final String trim : StringUtils.splitPreserveAllTokens(records[1], DELIM_ANNO_READ_PAIR)) {
                try {
                    trims.add(Integer.parseInt(trim));
                } catch (final NumberFormatException e) {
                    throw new DupligangerException("Malformed 5' trim '" + trim + "' in read name " + qname, e);
                }
            }
            if (trims.size() != umis.size()) {
                throw new DupligangerException("Read name carries " + umis.size() + " UMIs but " + trims.size() +
                        " 5' trims: " + qname);
            }
        }
        return new ReadNameAnnotation(qname.substring(0, annoStart), umis, trims);
    }

    /** @return the read name without its annotation */
    public String getReadName() {
        return readName;
    }

    /** @return one UMI per read of the pair (or a single UMI for single-end data) */
    public List<String> getUmis() {
        return umis;
    }

    /** @return one 5' trim length per read of the pair (or a single trim for single-end data), empty if not annotated */
    public List<Integer> getFivePrimeTrims() {
        return fivePrimeTrims;
    }

    /**
     * @return the 5' trim of the read at {@code readIndex} of a ReadGroup.  Reads alternate between mates.
     * @throws DupligangerException if the read name carries no 5' trim annotation
     */
    public int getFivePrimeTrim(final int readIndex) {
        if (fivePrimeTrims.isEmpty()) {
            throw new DupligangerException("Read name is not annotated with 5' trims: " + readName);
        }
        return fivePrimeTrims.get(readIndex % fivePrimeTrims.size());
    }
}
