package io.brickmux.mux;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Optional;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests for {@link MuxOptionsConfig}.
 */
public class MuxOptionsConfigTest {

    @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

    @Test
    public void testLoadDefault() throws Exception {
        MuxOptionsConfig config = MuxOptionsConfig.loadDefault();
        assertFalse(config.getRules().isEmpty());
        assertTrue(config.isMuxSensitive("write-behind.trickling-writes"));
        assertTrue(config.isMuxSensitive("io-threads.thread-count"));
        assertFalse(config.isMuxSensitive("cluster.brick-multiplex"));
        assertFalse(config.isMuxSensitive("performance.readdir-ahead"));
        assertEquals(Optional.of("off"), config.getDefault("write-behind.trickling-writes"));
    }

    @Test
    public void testPrefixRules() {
        MuxOptionsConfig config = new MuxOptionsConfig(Arrays.asList(
                new MuxOptionsConfig.Rule("io-threads.*", "16"),
                new MuxOptionsConfig.Rule("io-threads.idle-time", "120")));
        assertTrue(config.isMuxSensitive("io-threads.thread-count"));
        assertFalse(config.isMuxSensitive("io-threads."));
        assertFalse(config.isMuxSensitive("io-threads"));
        assertFalse(config.isMuxSensitive("io-threadsx.count"));

        // exact rules win over prefix rules regardless of order
        assertEquals(Optional.of("120"), config.getDefault("io-threads.idle-time"));
        assertEquals(Optional.of("16"), config.getDefault("io-threads.thread-count"));
        assertEquals(Optional.empty(), config.getDefault("posix.health-check"));
    }

    @Test
    public void testLoadFile() throws Exception {
        File file = tempFolder.newFile("options.yml");
        Files.write(file.toPath(), (
                "mux-sensitive-options:\n" +
                "  - name: features.bitrot\n" +
                "    default: \"off\"\n" +
                "  - name: auth.*\n").getBytes(StandardCharsets.UTF_8));
        MuxOptionsConfig config = MuxOptionsConfig.load(file);
        assertEquals(2, config.getRules().size());
        assertTrue(config.isMuxSensitive("features.bitrot"));
        assertTrue(config.isMuxSensitive("auth.allow"));
        assertFalse(config.isMuxSensitive("write-behind.trickling-writes"));
        assertEquals(Optional.of("off"), config.getDefault("features.bitrot"));
        assertEquals(Optional.empty(), config.getDefault("auth.allow"));
    }

    @Test
    public void testEmptyFile() throws Exception {
        File file = tempFolder.newFile("empty.yml");
        Files.write(file.toPath(), "mux-sensitive-options:\n".getBytes(StandardCharsets.UTF_8));
        MuxOptionsConfig config = MuxOptionsConfig.load(file);
        assertTrue(config.getRules().isEmpty());
        assertFalse(config.isMuxSensitive("write-behind.trickling-writes"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRuleWithoutName() {
        new MuxOptionsConfig.Rule(" ", "on");
    }
}
