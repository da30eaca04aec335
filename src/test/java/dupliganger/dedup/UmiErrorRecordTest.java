package dupliganger.dedup;

import dupliganger.DupligangerException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public class UmiErrorRecordTest {
    private final UmiErrorRecord.Codec codec = new UmiErrorRecord.Codec();

    private static UmiErrorRecord pair(final UmiErrorRecord.MateUmiError mate1, final UmiErrorRecord.MateUmiError mate2) {
        return new UmiErrorRecord(Arrays.asList(mate1, mate2));
    }

    @Test
    public void testMaxDistance() {
        final UmiErrorRecord record = pair(new UmiErrorRecord.MateUmiError(1, 2, null),
                new UmiErrorRecord.MateUmiError(3, 1, null));
        Assert.assertEquals(record.getMaxDistance(), 3);
    }

    @Test
    public void testSamTags() {
        final UmiErrorRecord record = pair(new UmiErrorRecord.MateUmiError(1, 1, "GGCCTAAT"),
                new UmiErrorRecord.MateUmiError(0, 1, null));
        Assert.assertEquals(record.toSamTags(0), "d1:i:1\tn1:i:1\tc1:Z:GGCCTAAT");
        Assert.assertEquals(record.toSamTags(1), "d2:i:0\tn2:i:1");
        // secondary alignments of a pair repeat the tags of their mate
        Assert.assertEquals(record.toSamTags(2), record.toSamTags(0));
        Assert.assertEquals(record.toSamTags(3), record.toSamTags(1));
    }

    @Test
    public void testSingleEndSamTags() {
        final UmiErrorRecord record = new UmiErrorRecord(Collections.singletonList(new UmiErrorRecord.MateUmiError(2, 3, null)));
        Assert.assertEquals(record.toSamTags(0), "d1:i:2\tn1:i:3");
        Assert.assertEquals(record.toSamTags(1), "d1:i:2\tn1:i:3");
    }

    @Test
    public void testCodec() {
        final UmiErrorRecord record = pair(new UmiErrorRecord.MateUmiError(1, 1, "GGCCTAAT"),
                new UmiErrorRecord.MateUmiError(2, 4, null));
        final String stored = codec.encode(record);
        Assert.assertEquals(stored, "1,1,GGCCTAAT^2,4,");
        Assert.assertEquals(codec.decode(stored), record);
    }

    @Test(expectedExceptions = DupligangerException.class)
    public void testMalformedStoredRecord() {
        codec.decode("1,1");
    }

    @Test(expectedExceptions = DupligangerException.class)
    public void testNonNumericStoredRecord() {
        codec.decode("x,1,");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNoMates() {
        new UmiErrorRecord(Collections.emptyList());
    }
}
