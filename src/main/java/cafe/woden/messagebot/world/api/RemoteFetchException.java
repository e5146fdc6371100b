package cafe.woden.messagebot.world.api;

/** A cached world resource could not be fetched from the server. */
public class RemoteFetchException extends RuntimeException {

  private final String resource;

  public RemoteFetchException(String resource, Throwable cause) {
    super("Failed to fetch " + resource + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
    this.resource = resource;
  }

  public String resource() {
    return resource;
  }
}
