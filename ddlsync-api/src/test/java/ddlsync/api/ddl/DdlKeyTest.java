package ddlsync.api.ddl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ddlsync.api.DdlFatalException;
import ddlsync.api.oplog.OplogEntry;
import java.util.List;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class DdlKeyTest {

  private static OplogEntry drop(int ts, String collection) {
    return OplogEntry.command(new BsonTimestamp(ts, 1), "db.$cmd", new Document("drop", collection));
  }

  @Test
  void sameNamespaceAndBodyAreTheSameDdl() {
    DdlKey a = DdlKey.of("rs0", drop(100, "coll"));
    DdlKey b = DdlKey.of("rs1", drop(150, "coll"));

    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
  }

  @Test
  void differentBodiesAreDifferentDdls() {
    assertThat(DdlKey.of("rs0", drop(100, "coll"))).isNotEqualTo(DdlKey.of("rs0", drop(100, "other")));
  }

  @Test
  void bodyKeepsBsonTypesApart() {
    OplogEntry intSize =
        OplogEntry.command(
            new BsonTimestamp(1, 1), "db.$cmd", new Document("create", "c").append("size", 1));
    OplogEntry longSize =
        OplogEntry.command(
            new BsonTimestamp(1, 1), "db.$cmd", new Document("create", "c").append("size", 1L));

    assertThat(DdlKey.of("rs0", intSize)).isNotEqualTo(DdlKey.of("rs0", longSize));
  }

  @Test
  void decodedBodyEqualsCapturedBody() {
    Document body =
        new Document("createIndexes", "coll")
            .append("indexes", List.of(new Document("key", new Document("a", 1)).append("name", "a_1")));
    OplogEntry entry = OplogEntry.command(new BsonTimestamp(7, 3), "db.$cmd", body);

    assertThat(DdlKey.of("rs0", entry).decodeBody()).isEqualTo(body);
  }

  @Test
  void unserializableBodyIsFatal() {
    OplogEntry entry =
        OplogEntry.command(
            new BsonTimestamp(1, 1), "db.$cmd", new Document("create", "c").append("bad", new Object()));

    assertThatThrownBy(() -> DdlKey.of("rs0", entry))
        .isInstanceOf(DdlFatalException.class)
        .hasMessageContaining("rs0")
        .hasMessageContaining("db.$cmd");
  }

  @Test
  void undecodableBodyIsFatal() {
    DdlKey key = new DdlKey("db.$cmd", "{not json");

    assertThatThrownBy(key::decodeBody)
        .isInstanceOf(DdlFatalException.class)
        .satisfies(e -> assertThat(((DdlFatalException) e).getKey()).contains(key));
  }

  @Test
  void keysAreOrderedByNamespaceThenBody() {
    DdlKey a1 = new DdlKey("a.$cmd", "{\"drop\": \"z\"}");
    DdlKey a2 = new DdlKey("a.$cmd", "{\"drop\": \"b\"}");
    DdlKey b = new DdlKey("b.$cmd", "{\"drop\": \"a\"}");

    assertThat(List.of(b, a1, a2).stream().sorted()).containsExactly(a2, a1, b);
  }
}
