package dupliganger.dedup;

/**
 * What to do with a ReadGroup one of whose UMIs is not a known UMI of the kit.
 */
public enum UmiErrorPolicy {
    /** Keep the ReadGroup and partition it by its UMIs as sequenced. */
    KEEP,
    /** Exclude the ReadGroup from duplicate detection and write it to the UMI error file. */
    REJECT,
    /** Keep the ReadGroup, replacing each UMI one base off exactly one known UMI with that UMI. */
    CORRECT
}
