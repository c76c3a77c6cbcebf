package ddlsync.api.ddl;

import com.google.common.collect.ComparisonChain;
import ddlsync.api.DdlFatalException;
import ddlsync.api.oplog.OplogEntry;
import java.util.Objects;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;

/**
 * Identity of a DDL: the namespace it was logged against plus its serialized body.
 *
 * <p>Two sources report "the same" DDL iff both components are equal. The body is serialized as
 * canonical Extended JSON, which keeps BSON types apart ({@code 1} and {@code 1L} differ) and can
 * be decoded back into an equal {@link Document}.
 *
 * <p>Keys are ordered by namespace, then body. The elimination loop uses this order to break ties
 * between DDLs reported at the same timestamp.
 */
public record DdlKey(String namespace, String body) implements Comparable<DdlKey> {

  private static final JsonWriterSettings CANONICAL =
      JsonWriterSettings.builder().outputMode(JsonMode.EXTENDED).build();

  public DdlKey {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(body, "body");
  }

  /**
   * Computes the identity of a captured DDL entry.
   *
   * @throws DdlFatalException if the body cannot be serialized
   */
  public static DdlKey of(String replicaSet, OplogEntry entry) {
    try {
      return new DdlKey(entry.namespace(), entry.object().toJson(CANONICAL));
    } catch (CodecConfigurationException | BSONException e) {
      throw new DdlFatalException(
          "Cannot serialize the body of DDL on " + entry.namespace(), replicaSet, null, e);
    }
  }

  /**
   * Decodes the serialized body.
   *
   * @throws DdlFatalException if the body is not valid Extended JSON
   */
  public Document decodeBody() {
    try {
      return Document.parse(body);
    } catch (JsonParseException | BSONException e) {
      throw new DdlFatalException("Cannot decode DDL body", null, this, e);
    }
  }

  @Override
  public int compareTo(DdlKey other) {
    return ComparisonChain.start()
        .compare(namespace, other.namespace)
        .compare(body, other.body)
        .result();
  }

  @Override
  public String toString() {
    return namespace + " " + body;
  }
}
