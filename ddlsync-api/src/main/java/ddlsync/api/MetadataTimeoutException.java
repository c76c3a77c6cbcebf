package ddlsync.api;

/** A metadata command did not complete within its configured timeout. */
public class MetadataTimeoutException extends DdlSyncException {

  public MetadataTimeoutException(Throwable cause) {
    super(cause);
  }
}
