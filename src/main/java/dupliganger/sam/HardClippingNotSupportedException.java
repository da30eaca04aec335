package dupliganger.sam;

import dupliganger.DupligangerException;

/**
 * Thrown when a CIGAR string contains hard clipping, since the unclipped 5' start of such a read cannot be recovered.
 */
public class HardClippingNotSupportedException extends DupligangerException {
    public HardClippingNotSupportedException(final String message) {
        super(message);
    }
}
