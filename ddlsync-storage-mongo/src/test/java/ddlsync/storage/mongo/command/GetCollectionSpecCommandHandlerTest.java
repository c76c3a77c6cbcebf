package ddlsync.storage.mongo.command;

import static org.assertj.core.api.Assertions.assertThat;

import ddlsync.api.metadata.ShardCollectionSpec;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class GetCollectionSpecCommandHandlerTest {

  @Test
  void specDefaultsWhenFieldsAreMissing() {
    ShardCollectionSpec spec = GetCollectionSpecCommandHandler.toSpec(new Document("_id", "db.c"));

    assertThat(spec.namespace()).isEqualTo("db.c");
    assertThat(spec.key()).isEmpty();
    assertThat(spec.unique()).isFalse();
  }
}
