package dupliganger.sam;

import dupliganger.db.ItemCodec;

/**
 * Stores ReadGroups in their {@link ReadGroup#toString()} form.
 */
public class ReadGroupCodec implements ItemCodec<ReadGroup> {
    @Override
    public String encode(final ReadGroup readGroup) {
        return readGroup.toString();
    }

    @Override
    public ReadGroup decode(final String stored) {
        return ReadGroup.parse(stored);
    }
}
