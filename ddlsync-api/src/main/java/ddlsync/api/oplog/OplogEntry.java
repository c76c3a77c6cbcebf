package ddlsync.api.oplog;

import ddlsync.api.ddl.DdlCommand;
import java.util.Iterator;
import java.util.Objects;
import org.bson.BsonTimestamp;
import org.bson.Document;

/**
 * The part of an oplog record the DDL coordination core works with.
 *
 * @param timestamp position of the record in its replica set's oplog
 * @param operation oplog op code, {@code "c"} for commands and {@code "i"} for inserts
 * @param namespace {@code <database>.<collection>} the record was written against; for commands
 *     this is usually {@code <database>.$cmd}
 * @param object the record's body, for a command the command document itself
 */
public record OplogEntry(
    BsonTimestamp timestamp, String operation, String namespace, Document object) {

  public static final String OP_COMMAND = "c";
  public static final String OP_INSERT = "i";

  public OplogEntry {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(object, "object");
  }

  public static OplogEntry command(BsonTimestamp timestamp, String namespace, Document object) {
    return new OplogEntry(timestamp, OP_COMMAND, namespace, object);
  }

  /** @return the database part of the namespace */
  public String databaseName() {
    int dot = namespace.indexOf('.');
    return dot < 0 ? namespace : namespace.substring(0, dot);
  }

  /** @return the collection part of the namespace, empty for a bare database name */
  public String collectionName() {
    int dot = namespace.indexOf('.');
    return dot < 0 ? "" : namespace.substring(dot + 1);
  }

  /** @return the first key of the body, which names a command; empty if the body is empty */
  public String commandName() {
    return DdlCommand.nameOf(object);
  }

  /** @return the value of the first key of the body, or {@code null} */
  public Object commandArgument() {
    Iterator<Object> values = object.values().iterator();
    return values.hasNext() ? values.next() : null;
  }

  /** @return a copy of this entry with another namespace and body, same timestamp */
  public OplogEntry withBody(String operation, String namespace, Document object) {
    return new OplogEntry(timestamp, operation, namespace, object);
  }

  @Override
  public String toString() {
    return "OplogEntry{ts="
        + Timestamps.format(timestamp)
        + ", op="
        + operation
        + ", ns="
        + namespace
        + ", o="
        + object.toJson()
        + '}';
  }
}
