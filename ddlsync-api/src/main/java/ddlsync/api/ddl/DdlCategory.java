package ddlsync.api.ddl;

/**
 * How a DDL has to be coordinated across sources.
 *
 * <ul>
 *   <li>{@link #ADDITIVE}: non-destructive, can be applied as soon as one source sees it.
 *   <li>{@link #DESTRUCTIVE}: must wait until no other source can still deliver data it would
 *       discard.
 *   <li>{@link #UNSUPPORTED}: has no safe cross-shard translation, the pipeline refuses it.
 *   <li>{@link #INDEX_BOOKKEEPING}: an insert into {@code <db>.system.indexes}, the legacy way of
 *       creating an index on a single shard.
 *   <li>{@link #UNKNOWN}: a command name outside the catalogue.
 * </ul>
 */
public enum DdlCategory {
  ADDITIVE,
  DESTRUCTIVE,
  UNSUPPORTED,
  INDEX_BOOKKEEPING,
  UNKNOWN;

  /** Collection name suffix of the legacy index catalogue. */
  public static final String SYSTEM_INDEXES = "system.indexes";

  public static boolean isIndexBookkeeping(String namespace) {
    return namespace.endsWith(SYSTEM_INDEXES);
  }

  /** Classifies a DDL by its namespace first, then by its command name. */
  public static DdlCategory classify(String namespace, String commandName) {
    if (isIndexBookkeeping(namespace)) {
      return INDEX_BOOKKEEPING;
    }
    return DdlCommand.fromName(commandName).map(DdlCommand::category).orElse(UNKNOWN);
  }
}
