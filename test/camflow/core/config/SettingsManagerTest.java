package camflow.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import camflow.core.logic.Easing;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsManagerTest {

    @TempDir
    File tempDir;

    private static EngineSettings customized() {
        EngineSettings s = new EngineSettings();
        s.setMaxZoom(2.5);
        s.setPaddingFraction(0.05);
        s.setTransitionDurationMs(650);
        s.setEndBufferMs(2000);
        s.setSizeEpsilonPx(0.5);
        s.setHoverBoxFraction(0.15);
        s.setHoverMinDurationMs(1200);
        s.setTargetPaddingFraction(0.2);
        s.setClickEffectDurationMs(400);
        s.setTransitionEasing(Easing.EASE_OUT);
        return s;
    }

    @Test
    void serializedFormStartsWithHeader() {
        String text = SettingsManager.serializeSettings(new EngineSettings());
        assertTrue(text.startsWith(SettingsManager.HEADER));
        assertTrue(text.contains("MAX_ZOOM:2.0"));
        assertTrue(text.contains("EASING:EASE_IN_OUT"));
    }

    @Test
    void stringRoundTrip() throws IOException {
        EngineSettings original = customized();
        assertEquals(original, SettingsManager.deserializeSettings(SettingsManager.serializeSettings(original)));
    }

    @Test
    void fileRoundTrip() throws IOException {
        File file = new File(tempDir, "engine.camflow");
        EngineSettings original = customized();

        SettingsManager.saveSettings(original, file);

        assertEquals(original, SettingsManager.loadSettings(file));
    }

    @Test
    void missingKeysKeepDefaults() throws IOException {
        EngineSettings loaded = SettingsManager.deserializeSettings(
            SettingsManager.HEADER + "\n\n# comment\nMAX_ZOOM:4\n");

        assertEquals(4.0, loaded.getMaxZoom());
        assertEquals(500, loaded.getTransitionDurationMs());
    }

    @Test
    void unknownKeysAreSkipped() throws IOException {
        EngineSettings loaded = SettingsManager.deserializeSettings(
            SettingsManager.HEADER + "\nFUTURE_OPTION:yes\nEND_BUFFER_MS:100\n");

        assertEquals(100, loaded.getEndBufferMs());
    }

    @Test
    void wrongHeaderFails() {
        assertThrows(IOException.class, () -> SettingsManager.deserializeSettings("PROJECT_V6\nMAX_ZOOM:2\n"));
        assertThrows(IOException.class, () -> SettingsManager.deserializeSettings(""));
    }

    @Test
    void badValuesFail() {
        IOException notNumber = assertThrows(IOException.class,
            () -> SettingsManager.deserializeSettings(SettingsManager.HEADER + "\nMAX_ZOOM:big\n"));
        assertTrue(notNumber.getMessage().contains("MAX_ZOOM"));

        IOException outOfRange = assertThrows(IOException.class,
            () -> SettingsManager.deserializeSettings(SettingsManager.HEADER + "\nPADDING:0.7\n"));
        assertTrue(outOfRange.getCause() instanceof IllegalArgumentException);

        assertThrows(IOException.class,
            () -> SettingsManager.deserializeSettings(SettingsManager.HEADER + "\nno separator here\n"));
        assertThrows(IOException.class,
            () -> SettingsManager.deserializeSettings(SettingsManager.HEADER + "\nEASING:BOUNCY\n"));
    }

    @Test
    void missingFileFails() {
        assertThrows(FileNotFoundException.class,
            () -> SettingsManager.loadSettings(new File(tempDir, "absent.camflow")));
    }
}
