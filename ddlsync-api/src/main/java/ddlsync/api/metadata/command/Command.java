package ddlsync.api.metadata.command;

/**
 * A metadata lookup answered by a {@link ddlsync.api.metadata.MetadataStore}. Implementations are
 * value records; a store finds the handler by the record's class.
 *
 * @param <R> type of the answer
 */
public interface Command<R> {}
