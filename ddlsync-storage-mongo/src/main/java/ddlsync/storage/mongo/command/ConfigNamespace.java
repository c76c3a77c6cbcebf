package ddlsync.storage.mongo.command;

/** Names in the cluster metadata the handlers read. */
public interface ConfigNamespace {

  String CONFIG_DB = "config";
  String ADMIN_DB = "admin";
  String COLLECTIONS = "collections";

  /** {@code hello} reply {@code msg} of a mongos router. */
  String MONGOS_MARKER = "isdbgrid";
}
