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
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.StringUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The library preparation kits whose UMIs are understood.  Each kit knows its fixed set of UMIs, so that a
 * sequenced UMI can be compared against the UMIs that could actually have been ligated.
 */
public enum UmiKit {
    /** The Bioo Scientific NEXTflex kit: 96 known 8-nt UMIs, followed by a T that is clipped with the UMI. */
    BIOO(1, "AACGCCAT", "AAGGTACG", "AATTCCGG", "ACACAGAG", "ACACTCAG",
            "ACACTGTG", "ACAGGACA", "ACCTGTAG", "ACGAAGGT", "ACGACTTG", "ACGTCAAC",
            "ACGTCATG", "ACTGTCAG", "ACTGTGAC", "AGACACTC", "AGAGGAGA", "AGCATCGT",
            "AGCATGGA", "AGCTACCA", "AGCTCTAG", "AGGACAAC", "AGGACATG", "AGGTTGCT",
            "AGTCGAGA", "AGTGCTGT", "ATAAGCGG", "ATCCATGG", "ATCGAACC", "ATCGCGTA",
            "ATCGTTGG", "CAACGATC", "CAACGTTG", "CAACTGGT", "CAAGTCGT", "CACACACA",
            "CAGTACTG", "CATCAGCA", "CATCGTTC", "CCAAGGTT", "CCTAGCTT", "CGATTACG",
            "CGCCTATT", "CGTTCCAT", "CGTTGGAT", "CTACGTTC", "CTACTCGT", "CTAGAGGA",
            "CTAGGAAG", "CTAGGTAC", "CTCAGTCT", "CTGACTGA", "CTGAGTGT", "CTGATGTG",
            "CTGTTCAC", "CTTCGTTG", "GAACAGGT", "GAAGACCA", "GAAGTGCA", "GACATGAG",
            "GAGAAGAG", "GAGAAGTC", "GATCCTAG", "GATGTCGT", "GCCGATAT", "GCCGATTA",
            "GCGGTATT", "GGAATTGG", "GGATAACG", "GGCCTAAT", "GGCGTATT", "GTCTTGTC",
            "GTGATGAG", "GTGATGTC", "GTGTACTG", "GTGTAGTC", "GTTCACCT", "GTTCTGCT",
            "GTTGTCGA", "TACGAACC", "TAGCAAGG", "TAGCTAGC", "TAGGTTCG", "TATAGCGC",
            "TCAGGACT", "TCCACATC", "TCGACTTC", "TCGTAGGT", "TCGTCATC", "TGAGACTC",
            "TGAGAGTG", "TGAGTGAG", "TGCTTGGA", "TGGAGTAG", "TGTGTGTG", "TTCGCCTA",
            "TTCGTTCG");

    private static final Log log = Log.getInstance(UmiKit.class);

    private final Set<String> umis;
    private final int umiLength;
    private final int clipLength;

    UmiKit(final int basesClippedAfterUmi, final String... umis) {
        this.umis = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(umis)));
        this.umiLength = umis[0].length();
        this.clipLength = umiLength + basesClippedAfterUmi;
    }

    /** @return the known UMIs of this kit, in a fixed order */
    public Set<String> getUmis() {
        return umis;
    }

    public int getUmiLength() {
        return umiLength;
    }

    /** @return the number of bases removed from the 5' end of a read to remove its UMI */
    public int getClipLength() {
        return clipLength;
    }

    /**
     * Finds the known UMIs nearest to a sequenced UMI by Hamming distance.  A known UMI is distance 0; otherwise
     * distances 1 through the UMI length are searched in turn, stopping at the first distance with any match.
     * A UMI that is not within {@link #getUmiLength()} of any known UMI is reported one past that distance with no
     * candidates.
     */
    public UmiMatch findNearest(final String sequencedUmi) {
        if (sequencedUmi.length() != umiLength) {
            throw new DupligangerException("UMI " + sequencedUmi + " is not " + umiLength + " bases long, as " + name() +
                    " UMIs are.");
        }
        if (umis.contains(sequencedUmi)) {
            return new UmiMatch(0, Collections.singletonList(sequencedUmi));
        }

        final List<String> candidates = new ArrayList<>();
        for (int distance = 1; distance <= umiLength; distance++) {
            for (final String umi : umis) {
                if (StringUtil.hammingDistance(umi, sequencedUmi) == distance) {
                    candidates.add(umi);
                }
            }
            if (!candidates.isEmpty()) {
                return new UmiMatch(distance, candidates);
            }
        }

        log.warn("UMI " + sequencedUmi + " is not within " + umiLength + " of any known " + name() + " UMI.");
        return new UmiMatch(umiLength + 1, Collections.emptyList());
    }
}
