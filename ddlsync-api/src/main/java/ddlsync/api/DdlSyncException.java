package ddlsync.api;

/** Base class of every error raised by the DDL coordination core. */
public class DdlSyncException extends RuntimeException {

  public DdlSyncException(Throwable cause) {
    super(cause);
  }

  public DdlSyncException(String message) {
    super(message);
  }

  public DdlSyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
