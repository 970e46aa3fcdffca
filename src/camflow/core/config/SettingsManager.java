package camflow.core.config;

import camflow.core.logic.Easing;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Saves and loads {@link EngineSettings} as .camflow settings files.
 *
 * <p>Format: a {@value #HEADER} line followed by {@code KEY:value} lines.
 * Unknown keys are skipped so newer files still load; a known key with a bad value fails the load.</p>
 */
public class SettingsManager {

    public static final String HEADER = "CAMFLOW_SETTINGS_V1";

    public static void saveSettings(EngineSettings settings, File file) throws IOException {
        Files.write(file.toPath(), serializeSettings(settings).getBytes(StandardCharsets.UTF_8));
        System.out.println("[SettingsManager] Settings saved to: " + file.getAbsolutePath());
    }

    public static EngineSettings loadSettings(File file) throws IOException {
        if (!file.isFile()) {
            throw new FileNotFoundException("Settings file not found: " + file.getAbsolutePath());
        }
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            EngineSettings settings = loadFromReader(reader);
            System.out.println("[SettingsManager] Settings loaded from: " + file.getAbsolutePath());
            return settings;
        }
    }

    public static String serializeSettings(EngineSettings s) {
        StringWriter sw = new StringWriter();
        try (PrintWriter writer = new PrintWriter(sw)) {
            writer.println(HEADER);
            writer.println("MAX_ZOOM:" + s.getMaxZoom());
            writer.println("PADDING:" + s.getPaddingFraction());
            writer.println("TRANSITION_MS:" + s.getTransitionDurationMs());
            writer.println("END_BUFFER_MS:" + s.getEndBufferMs());
            writer.println("SIZE_EPSILON_PX:" + s.getSizeEpsilonPx());
            writer.println("EASING:" + s.getTransitionEasing().name());
            writer.println("HOVER_BOX:" + s.getHoverBoxFraction());
            writer.println("HOVER_MIN_MS:" + s.getHoverMinDurationMs());
            writer.println("TARGET_PADDING:" + s.getTargetPaddingFraction());
            writer.println("CLICK_EFFECT_MS:" + s.getClickEffectDurationMs());
        }
        return sw.toString();
    }

    public static EngineSettings deserializeSettings(String state) throws IOException {
        return loadFromReader(new StringReader(state));
    }

    private static EngineSettings loadFromReader(Reader in) throws IOException {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String header = reader.readLine();
        if (header == null || !HEADER.equals(header.trim())) {
            throw new IOException("Not a camflow settings file (header: " + header + ")");
        }

        EngineSettings settings = new EngineSettings();
        String line;
        int lineNo = 1;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int sep = line.indexOf(':');
            if (sep < 0) {
                throw new IOException("Line " + lineNo + ": expected KEY:value but got '" + line + "'");
            }
            String key = line.substring(0, sep).trim();
            String value = line.substring(sep + 1).trim();
            try {
                apply(settings, key, value);
            } catch (IllegalArgumentException e) {
                // NumberFormatException is an IllegalArgumentException too
                throw new IOException("Line " + lineNo + ": bad value for " + key + ": " + e.getMessage(), e);
            }
        }
        return settings;
    }

    private static void apply(EngineSettings s, String key, String value) {
        switch (key) {
            case "MAX_ZOOM": s.setMaxZoom(Double.parseDouble(value)); break;
            case "PADDING": s.setPaddingFraction(Double.parseDouble(value)); break;
            case "TRANSITION_MS": s.setTransitionDurationMs(Long.parseLong(value)); break;
            case "END_BUFFER_MS": s.setEndBufferMs(Long.parseLong(value)); break;
            case "SIZE_EPSILON_PX": s.setSizeEpsilonPx(Double.parseDouble(value)); break;
            case "EASING": s.setTransitionEasing(Easing.valueOf(value)); break;
            case "HOVER_BOX": s.setHoverBoxFraction(Double.parseDouble(value)); break;
            case "HOVER_MIN_MS": s.setHoverMinDurationMs(Long.parseLong(value)); break;
            case "TARGET_PADDING": s.setTargetPaddingFraction(Double.parseDouble(value)); break;
            case "CLICK_EFFECT_MS": s.setClickEffectDurationMs(Long.parseLong(value)); break;
            default:
                System.out.println("[SettingsManager] Ignoring unknown key: " + key);
        }
    }
}
