package camflow.core.media;

import java.io.IOException;

/**
 * The recording exists but its container could not be opened or has no video stream.
 */
public class MediaProbeException extends IOException {

    public MediaProbeException(String message) {
        super(message);
    }

    public MediaProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
