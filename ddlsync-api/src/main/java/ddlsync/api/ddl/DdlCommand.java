package ddlsync.api.ddl;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Optional;
import java.util.function.Function;
import org.bson.Document;

/** The DDL command names the coordinator knows how to reason about. */
public enum DdlCommand {
  CREATE("create", DdlCategory.ADDITIVE),
  CREATE_INDEXES("createIndexes", DdlCategory.ADDITIVE),
  COLL_MOD("collMod", DdlCategory.ADDITIVE),

  DELETE_INDEX("deleteIndex", DdlCategory.DESTRUCTIVE),
  DELETE_INDEXES("deleteIndexes", DdlCategory.DESTRUCTIVE),
  DROP_INDEX("dropIndex", DdlCategory.DESTRUCTIVE),
  DROP_INDEXES("dropIndexes", DdlCategory.DESTRUCTIVE),
  DROP_DATABASE("dropDatabase", DdlCategory.DESTRUCTIVE),
  DROP("drop", DdlCategory.DESTRUCTIVE),

  RENAME_COLLECTION("renameCollection", DdlCategory.UNSUPPORTED),
  CONVERT_TO_CAPPED("convertToCapped", DdlCategory.UNSUPPORTED),
  EMPTY_CAPPED("emptycapped", DdlCategory.UNSUPPORTED),
  APPLY_OPS("applyOps", DdlCategory.UNSUPPORTED);

  private static final ImmutableMap<String, DdlCommand> BY_NAME =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(DdlCommand::commandName, Function.identity()));

  private final String commandName;
  private final DdlCategory category;

  DdlCommand(String commandName, DdlCategory category) {
    this.commandName = commandName;
    this.category = category;
  }

  /** @return the command name as it appears as the first key of an oplog command body */
  public String commandName() {
    return commandName;
  }

  public DdlCategory category() {
    return category;
  }

  /** @return the first key of a command body, empty if the body is empty */
  public static String nameOf(Document body) {
    Iterator<String> keys = body.keySet().iterator();
    return keys.hasNext() ? keys.next() : "";
  }

  /** Command names are case sensitive, as they are for the server. */
  public static Optional<DdlCommand> fromName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
