package dupliganger.db;

/** The backends a {@link Database} may be created with. */
public enum StoreType {
    /** An H2 MVStore file; durable, transactional and bounded in memory. */
    DISK,
    /** Plain in-memory maps; no durability, transactions cost nothing. */
    MEMORY
}
