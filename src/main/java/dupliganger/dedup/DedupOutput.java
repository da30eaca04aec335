package dupliganger.dedup;

/**
 * The output files of a deduplication run, named {@code <prefix>.<suffix>}.
 */
public enum DedupOutput {
    /** The input with duplicates and rejected ReadGroups removed. */
    DEDUPPED("dups_removed.sam"),
    /** The input less rejected ReadGroups, with duplicates flagged 0x400. */
    FLAGGED("dups_flagged.sam"),
    /** The duplicates only, flagged 0x400. */
    DUPLICATES("duplicates.sam"),
    /** The members of each duplicate group, one group per paragraph. */
    DUP_GROUPS("dup_groups.samlike"),
    /** ReadGroups rejected for a UMI error. */
    UMI_ERRORS("umi_errors.sam");

    private final String suffix;

    DedupOutput(final String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getFileName(final String prefix) {
        return prefix + "." + suffix;
    }
}
