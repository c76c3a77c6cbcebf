package ddlsync.api.ddl;

import static org.assertj.core.api.Assertions.assertThat;

import ddlsync.api.oplog.OplogEntry;
import java.util.List;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class DdlNamespacesTest {

  private static OplogEntry entry(String namespace, Document body) {
    return OplogEntry.command(new BsonTimestamp(1, 1), namespace, body);
  }

  @Test
  void collectionCommandTargetsNamedCollection() {
    assertThat(DdlNamespaces.targetNamespace(entry("shop.$cmd", new Document("drop", "orders"))))
        .isEqualTo("shop.orders");
  }

  @Test
  void dropDatabaseTargetsDatabase() {
    String ns = DdlNamespaces.targetNamespace(entry("shop.$cmd", new Document("dropDatabase", 1)));

    assertThat(ns).isEqualTo("shop");
    assertThat(DdlNamespaces.isDatabase(ns)).isTrue();
  }

  @Test
  void indexInsertTargetsItsNsField() {
    OplogEntry insert =
        new OplogEntry(
            new BsonTimestamp(1, 1),
            OplogEntry.OP_INSERT,
            "shop.system.indexes",
            new Document("ns", "shop.orders").append("key", new Document("a", 1)));

    assertThat(DdlNamespaces.targetNamespace(insert)).isEqualTo("shop.orders");
  }

  @Test
  void nonStringArgumentTargetsDatabase() {
    assertThat(DdlNamespaces.targetNamespace(entry("shop.$cmd", new Document("applyOps", List.of()))))
        .isEqualTo("shop");
  }

  @Test
  void renameCollectionTargetsItsFullSourceNamespace() {
    OplogEntry rename =
        entry(
            "admin.$cmd",
            new Document("renameCollection", "shop.orders").append("to", "shop.archive"));

    assertThat(DdlNamespaces.targetNamespace(rename)).isEqualTo("shop.orders");
  }
}
