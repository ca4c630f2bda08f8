package in.epicast.domain.common;

/**
 * Exception thrown when a static metadata file cannot be read at all.
 */
public class MetadataLoadException extends RuntimeException {

    private final String location;

    public MetadataLoadException(String location, String message, Throwable cause) {
        super(String.format("[%s] %s", location, message), cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
