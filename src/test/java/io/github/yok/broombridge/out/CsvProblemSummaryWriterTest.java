package io.github.yok.broombridge.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.broombridge.core.document.ProblemDescription;
import io.github.yok.broombridge.core.document.YamlBroombridgeReader;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.parse.InitialStateParser;
import io.github.yok.broombridge.core.parse.OperatorTokenDecoder;
import io.github.yok.broombridge.core.parse.TermListParser;
import io.github.yok.broombridge.core.problem.ProblemExtractor;
import io.github.yok.broombridge.core.problem.TypedProblem;
import io.github.yok.broombridge.core.version.SchemaVersion;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CsvProblemSummaryWriterTest {

    @TempDir
    Path outputDir;

    private static TypedProblem fixtureProblem() throws Exception {
        Path fixture = Paths.get(
                CsvProblemSummaryWriterTest.class.getResource("/broombridge/h2_sto3g.yaml").toURI());
        ProblemDescription description =
                new YamlBroombridgeReader().read(fixture).getProblemDescriptions().get(0);
        ProblemExtractor extractor = new ProblemExtractor(
                new InitialStateParser(new TermListParser(new OperatorTokenDecoder())));
        return extractor.extract(description, IndexConvention.UP_DOWN);
    }

    @Test
    void writesOneFilePerKind() throws Exception {
        new CsvProblemSummaryWriter(outputDir.toString()).write(fixtureProblem(),
                SchemaVersion.V0_2, 1);

        List<String> oneBody = Files.readAllLines(
                outputDir.resolve("broombridge_oneBody_p=1.csv"), StandardCharsets.UTF_8);
        assertEquals("indices,convention,coefficient", oneBody.get(0));
        assertEquals(3, oneBody.size());
        assertEquals("0 0,MULLIKEN,-1.252477495", oneBody.get(1));

        List<String> twoBody = Files.readAllLines(
                outputDir.resolve("broombridge_twoBody_p=1.csv"), StandardCharsets.UTF_8);
        assertEquals(5, twoBody.size());
        assertEquals("1 0 1 0,MULLIKEN,0.181287518", twoBody.get(3));

        List<String> meta = Files.readAllLines(outputDir.resolve("broombridge_meta_p=1.csv"),
                StandardCharsets.UTF_8);
        assertTrue(meta.contains("version,0.2"));
        assertTrue(meta.contains("nOrbitals,2"));
        assertTrue(meta.contains("initialStates,3"));
    }

    @Test
    void writesSuperpositionRowsWithReencodedOperators() throws Exception {
        new CsvProblemSummaryWriter(outputDir.toString()).write(fixtureProblem(),
                SchemaVersion.V0_2, 2);

        List<String> states = Files.readAllLines(
                outputDir.resolve("broombridge_initialStates_p=2.csv"), StandardCharsets.UTF_8);

        // ヘッダ + |G>(1) + UCCSD(3) + HF(1)
        assertEquals(6, states.size());
        assertTrue(states.get(1).endsWith("(1a)+ (1b)+"));
        assertTrue(states.get(2).contains("UNITARY_COUPLED_CLUSTER,0,0.001,0.0,0.001,(2a)+ (1a)"));
        assertTrue(states.get(4).contains("UNITARY_COUPLED_CLUSTER,2,1.0,0.0,1.0,(1a)+ (1b)+"));
        assertTrue(states.get(5).contains("SINGLE_CONFIGURATIONAL"));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new CsvProblemSummaryWriter(""));
        CsvProblemSummaryWriter writer = new CsvProblemSummaryWriter(outputDir.toString());
        assertThrows(IllegalArgumentException.class,
                () -> writer.write(fixtureProblem(), SchemaVersion.V0_2, 0));
    }
}
