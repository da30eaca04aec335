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

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public class LocationKeysTest {
    private static final String QNAME = "D00597:180:C7NMDANXX:6:1101:1184:39633-GGCCTAAT^AGCTCTAG;2^3";

    private static ReadGroup pair(final String qname, final int pos1, final String cigar1, final int pos2, final String cigar2) {
        return new ReadGroup(Arrays.asList(
                new Read(qname, 99, "chr5", pos1, "60", cigar1),
                new Read(qname, 147, "chr5", pos2, "60", cigar2)));
    }

    @Test
    public void testLocationKeyWith5pTrimming() {
        // read 1: forward, synthetic start 95, trimmed 2 -> 93
        // read 2: reverse, synthetic start 200 + 100 - 1 + 4 = 303, trimmed 3 -> 306
        final ReadGroup readGroup = pair(QNAME, 100, "5S100M", 200, "100M4S");
        Assert.assertEquals(LocationKeys.toLocationKeyWith5pTrimming(readGroup), "chr5:93:+,chr5:306:-");
    }

    @Test
    public void testLocationKeyNo5pTrim() {
        final ReadGroup readGroup = pair(QNAME, 100, "5S100M", 200, "100M4S");
        Assert.assertEquals(LocationKeys.toLocationKeyNo5pTrim(readGroup), "chr5:95:+,chr5:303:-");
        Assert.assertEquals(LocationKeys.forTrimming(false).apply(readGroup), "chr5:95:+,chr5:303:-");
    }

    @Test
    public void testNoTrimKeyDoesNotNeedTrimAnnotation() {
        final ReadGroup readGroup = pair("read1-GGCCTAAT^AGCTCTAG", 100, "100M", 200, "100M");
        Assert.assertEquals(LocationKeys.toLocationKeyNo5pTrim(readGroup), "chr5:100:+,chr5:299:-");
    }

    @Test
    public void testClippedAndUnclippedReadsShareALocation() {
        final ReadGroup clipped = pair("a-GGCCTAAT^AGCTCTAG;0^0", 105, "5S95M", 200, "100M");
        final ReadGroup unclipped = pair("b-GGCCTAAT^AGCTCTAG;0^0", 100, "100M", 200, "100M");
        Assert.assertEquals(LocationKeys.toLocationKeyWith5pTrimming(clipped), LocationKeys.toLocationKeyWith5pTrimming(unclipped));
    }

    @Test
    public void testLocationKeyIsOrderSensitive() {
        final Read read1 = new Read("a-GGCCTAAT^AGCTCTAG;0^0", 99, "chr1", 100, "60", "50M");
        final Read read2 = new Read("a-GGCCTAAT^AGCTCTAG;0^0", 147, "chr1", 300, "60", "50M");
        final String key = LocationKeys.toLocationKeyWith5pTrimming(new ReadGroup(Arrays.asList(read1, read2)));
        final String swapped = LocationKeys.toLocationKeyWith5pTrimming(new ReadGroup(Arrays.asList(read2, read1)));
        Assert.assertNotEquals(key, swapped);
        Assert.assertEquals(LocationKeys.toLocationKeyWith5pTrimming(new ReadGroup(Arrays.asList(read1, read2))), key);
    }

    @Test(expectedExceptions = HardClippingNotSupportedException.class)
    public void testHardClippedReadHasNoLocation() {
        LocationKeys.toLocationKeyWith5pTrimming(pair(QNAME, 100, "5H100M", 200, "100M"));
    }
}
