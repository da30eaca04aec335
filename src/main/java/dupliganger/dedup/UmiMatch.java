package dupliganger.dedup;

import java.util.Collections;
import java.util.List;

/**
 * The known UMIs nearest to a sequenced UMI, and their Hamming distance from it.
 */
public final class UmiMatch {
    private final int distance;
    private final List<String> candidates;

    public UmiMatch(final int distance, final List<String> candidates) {
        this.distance = distance;
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public int getDistance() {
        return distance;
    }

    /** @return every known UMI at {@link #getDistance()} from the sequenced UMI */
    public List<String> getCandidates() {
        return candidates;
    }

    public boolean isExact() {
        return distance == 0;
    }

    /** @return true if the UMI is at most one base off a single known UMI, so that a correction is unambiguous */
    public boolean isCorrectable() {
        return distance <= 1 && candidates.size() <= 1;
    }

    /** @return the single known UMI one base away, if this UMI can be corrected to it, otherwise null */
    public String getCorrection() {
        return distance == 1 && candidates.size() == 1 ? candidates.get(0) : null;
    }

    @Override
    public String toString() {
        return distance + " " + candidates;
    }
}
