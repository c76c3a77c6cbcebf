package ddlsync.api.ddl;

import ddlsync.api.oplog.OplogEntry;

/** Resolves the namespace a DDL actually acts upon. */
public final class DdlNamespaces {

  private DdlNamespaces() {}

  /**
   * Returns the namespace whose sharding state decides how the DDL is coordinated.
   *
   * <ul>
   *   <li>an index bookkeeping insert acts on the collection named by its {@code ns} field;
   *   <li>{@code dropDatabase} acts on the whole database, the bare database name is returned;
   *   <li>{@code renameCollection} names its source collection by full namespace, which is
   *       returned as is;
   *   <li>any other command acts on {@code <db>.<first value of the body>} when that value is a
   *       string, otherwise on the database.
   * </ul>
   */
  public static String targetNamespace(OplogEntry entry) {
    if (DdlCategory.isIndexBookkeeping(entry.namespace())) {
      Object ns = entry.object().get("ns");
      return ns instanceof String s ? s : entry.databaseName();
    }
    String command = entry.commandName();
    if (DdlCommand.DROP_DATABASE.commandName().equals(command)) {
      return entry.databaseName();
    }
    if (DdlCommand.RENAME_COLLECTION.commandName().equals(command)
        && entry.commandArgument() instanceof String namespace) {
      return namespace;
    }
    return entry.commandArgument() instanceof String collection
        ? entry.databaseName() + "." + collection
        : entry.databaseName();
  }

  /** @return whether the namespace names a whole database rather than one collection */
  public static boolean isDatabase(String namespace) {
    return namespace.indexOf('.') < 0;
  }
}
