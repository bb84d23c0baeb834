package io.github.yok.nport.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NportCliRunnerTest {

    @TempDir
    Path tempDir;

    private NportProperties properties() {
        NportProperties p = new NportProperties();
        p.getDevice().setSamples(List.of(NportConfigurationTest.sample(1e9, 100),
                NportConfigurationTest.sample(2e9, 25)));
        p.getAnalysis().setFrequencies(List.of(1e9, 1.5e9, 2e9));
        p.getAnalysis().setTargetType("S");
        p.getOutput().setDir(tempDir.toString());
        return p;
    }

    @Test
    void runAnalyzesDeviceAndWritesCsv() throws IOException {
        NportProperties p = properties();
        NportConfiguration config = new NportConfiguration(p);
        NportCliRunner runner = new NportCliRunner(p, config.deviceSweep(),
                config.sweepAnalyzer(), config.sweepWriter());

        runner.run();

        List<String> params = Files.readAllLines(tempDir.resolve("nport_parameters_S.csv"),
                StandardCharsets.UTF_8);
        assertEquals(1 + 3, params.size());
        // Z = 100 Ω は 50 Ω 基準で S = 1/3
        assertTrue(params.get(1).startsWith("1.0E9,1,1,0.333333333333"));

        List<String> meta =
                Files.readAllLines(tempDir.resolve("nport_meta_S.csv"), StandardCharsets.UTF_8);
        assertTrue(meta.contains("referenceImpedance,50.0"));
        assertTrue(meta.contains("passive,true"));
    }

    @Test
    void multilineStringListsAllSections() {
        String text = properties().toMultilineString();

        assertTrue(text.contains("  device:"));
        assertTrue(text.contains("    samples: 2"));
        assertTrue(text.contains("    targetType: S"));
        assertTrue(text.contains("    dir: " + tempDir));
    }
}
