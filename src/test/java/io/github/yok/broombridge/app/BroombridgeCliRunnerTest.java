package io.github.yok.broombridge.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(properties = {
        "broombridge.input.path=src/test/resources/broombridge/h2_sto3g.yaml",
        "broombridge.index-convention=HALF_UP"})
class BroombridgeCliRunnerTest {

    /**
     * 実行ごとに新しく作る出力先です。
     */
    private static final Path OUTPUT_DIR = createOutputDir();

    @Autowired
    private BroombridgeProperties properties;

    private static Path createOutputDir() {
        try {
            return Files.createTempDirectory("broombridge-cli-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void outputDir(DynamicPropertyRegistry registry) {
        registry.add("broombridge.output.dir", OUTPUT_DIR::toString);
    }

    @Test
    void runsAgainstFixtureAndWritesSummaries() throws IOException {
        assertEquals("HALF_UP", properties.getIndexConvention().name());
        assertEquals(OUTPUT_DIR.toString(), properties.getOutput().getDir());

        List<String> meta = Files.readAllLines(OUTPUT_DIR.resolve("broombridge_meta_p=1.csv"),
                StandardCharsets.UTF_8);
        assertTrue(meta.contains("version,0.2"));
        assertTrue(meta.contains("nOrbitals,2"));
        assertTrue(meta.contains("initialStates,3"));
        assertTrue(meta.contains("indexConvention,HALF_UP"));

        List<String> oneBody = Files.readAllLines(
                OUTPUT_DIR.resolve("broombridge_oneBody_p=1.csv"), StandardCharsets.UTF_8);
        assertEquals(3, oneBody.size());

        List<String> twoBody = Files.readAllLines(
                OUTPUT_DIR.resolve("broombridge_twoBody_p=1.csv"), StandardCharsets.UTF_8);
        assertEquals(5, twoBody.size());

        List<String> states = Files.readAllLines(
                OUTPUT_DIR.resolve("broombridge_initialStates_p=1.csv"), StandardCharsets.UTF_8);
        // UCC の参照状態は重ね合わせの末尾（position=2）
        assertTrue(states.get(4)
                .startsWith("UCCSD |G>,UNITARY_COUPLED_CLUSTER,2,1.0,0.0,1.0,(1a)+ (1b)+"));
        assertTrue(states.get(5).startsWith("HF,SINGLE_CONFIGURATIONAL"));
    }
}
