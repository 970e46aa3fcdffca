package camflow.core.media;

import java.io.File;
import java.io.FileNotFoundException;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FrameGrabber;

/**
 * Reads size, duration and frame rate of a recording through FFmpeg without decoding frames.
 */
public class RecordingProbe {

    public static SourceInfo probe(File file) throws FileNotFoundException, MediaProbeException {
        // Checked first so a missing file never touches the native libraries
        if (!file.isFile()) {
            throw new FileNotFoundException("Recording not found: " + file.getAbsolutePath());
        }
        return probeContainer(file);
    }

    private static SourceInfo probeContainer(File file) throws MediaProbeException {
        System.out.println("[RecordingProbe] Probing: " + file.getName());
        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(file);
        grabber.setOption("probesize", "10485760"); // 10MB
        grabber.setOption("analyzeduration", "10000000"); // 10s
        try {
            grabber.start();
            int width = grabber.getImageWidth();
            int height = grabber.getImageHeight();
            if (width <= 0 || height <= 0) {
                throw new MediaProbeException("No video stream in " + file.getName());
            }
            long durationMs = grabber.getLengthInTime() / 1000L; // microseconds
            double fps = grabber.getFrameRate();
            SourceInfo info = new SourceInfo(file.getAbsolutePath(), width, height, Math.max(0, durationMs), fps);
            System.out.println("[RecordingProbe] " + info);
            return info;
        } catch (FrameGrabber.Exception e) {
            throw new MediaProbeException("Could not open " + file.getName() + ": " + e.getMessage(), e);
        } finally {
            try {
                grabber.stop();
                grabber.release();
            } catch (FrameGrabber.Exception e) {
                System.err.println("[RecordingProbe] Failed to release grabber: " + e.getMessage());
            }
        }
    }
}
