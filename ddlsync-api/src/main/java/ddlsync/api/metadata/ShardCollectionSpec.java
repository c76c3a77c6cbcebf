package ddlsync.api.metadata;

import java.util.Objects;
import org.bson.Document;

/**
 * Sharding definition of a collection as recorded in the source cluster's metadata.
 *
 * @param namespace {@code <db>.<collection>}
 * @param key the shard key pattern, e.g. {@code {userId: 1}} or {@code {_id: "hashed"}}
 * @param unique whether the shard key is unique
 */
public record ShardCollectionSpec(String namespace, Document key, boolean unique) {

  public ShardCollectionSpec {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(key, "key");
  }

  public String databaseName() {
    int dot = namespace.indexOf('.');
    return dot < 0 ? namespace : namespace.substring(0, dot);
  }

  public String collectionName() {
    int dot = namespace.indexOf('.');
    return dot < 0 ? "" : namespace.substring(dot + 1);
  }
}
