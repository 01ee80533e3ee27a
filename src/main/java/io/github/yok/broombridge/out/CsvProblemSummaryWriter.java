package io.github.yok.broombridge.out;

import io.github.yok.broombridge.core.integral.OrbitalIntegral;
import io.github.yok.broombridge.core.operator.LadderOperator;
import io.github.yok.broombridge.core.parse.AmplitudeTerm;
import io.github.yok.broombridge.core.parse.InputState;
import io.github.yok.broombridge.core.problem.TypedProblem;
import io.github.yok.broombridge.core.version.SchemaVersion;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 変換結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（p は文書内の問題番号）。
 * </p>
 *
 * <ul>
 * <li>{@code broombridge_oneBody_p=1.csv}</li>
 * <li>{@code broombridge_twoBody_p=1.csv}</li>
 * <li>{@code broombridge_initialStates_p=1.csv}</li>
 * <li>{@code broombridge_meta_p=1.csv}（軌道数・電子数・恒等項など）</li>
 * </ul>
 *
 * <p>
 * 軌道添字は 0 始まりのまま出力します。 初期状態の演算子列のみ、文書と同じ 1 始まりのトークン表記に戻します。
 * </p>
 */
public final class CsvProblemSummaryWriter implements ProblemSummaryWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "broombridge";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvProblemSummaryWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 型付けされた問題を出力します。
     *
     * @param problem 型付けされた問題です
     * @param version 文書のスキーマバージョンです
     * @param problemNumber 文書内での問題番号（1 始まり）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(TypedProblem problem, SchemaVersion version, int problemNumber) {
        if (problem == null) {
            throw new IllegalArgumentException("problem は null 不可です");
        }
        if (version == null) {
            throw new IllegalArgumentException("version は null 不可です");
        }
        if (problemNumber <= 0) {
            throw new IllegalArgumentException("問題番号は 1 以上を指定してください: " + problemNumber);
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 1 電子積分
            writeIntegralCsv(problem.getOneBodyTerms(), buildFileName("oneBody", problemNumber));

            // 2) 2 電子積分
            writeIntegralCsv(problem.getTwoBodyTerms(), buildFileName("twoBody", problemNumber));

            // 3) 初期状態
            writeInitialStatesCsv(problem, problemNumber);

            // 4) メタ
            writeMetaCsv(problem, version, problemNumber);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 軌道積分を出力します。
     *
     * @param integrals 軌道積分です
     * @param fileName ファイル名です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeIntegralCsv(Set<OrbitalIntegral> integrals, String fileName)
            throws IOException {

        Path file = outputDir.resolve(fileName);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("indices", "convention", "coefficient").build().print(w)) {

            for (OrbitalIntegral integral : integrals) {
                pr.printRecord(joinIndices(integral.getOrbitalIndices()),
                        integral.getConvention(), integral.getCoefficient());
            }
        }
    }

    /**
     * 初期状態の重ね合わせを出力します（1 行 = 重ね合わせの 1 要素）。
     *
     * <p>
     * 重ね合わせを持たない初期状態は、position を空欄にした 1 行だけを出力します。
     * </p>
     *
     * @param problem 型付けされた問題です
     * @param problemNumber 問題番号です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeInitialStatesCsv(TypedProblem problem, int problemNumber)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("initialStates", problemNumber));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("label", "type", "position", "real", "imaginary",
                                "termCoefficient", "operators")
                        .build().print(w)) {

            for (InputState state : problem.getInitialStates().values()) {
                List<AmplitudeTerm> superposition = state.getSuperposition();
                if (superposition.isEmpty()) {
                    pr.printRecord(state.getLabel(), state.getType(), "", "", "", "", "");
                    continue;
                }
                for (int i = 0; i < superposition.size(); i++) {
                    AmplitudeTerm t = superposition.get(i);
                    pr.printRecord(state.getLabel(), state.getType(), i, t.getReal(),
                            t.getImaginary(), t.getTerm().getCoefficient(),
                            joinOperators(t.getTerm().getOperators()));
                }
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param problem 型付けされた問題です
     * @param version スキーマバージョンです
     * @param problemNumber 問題番号です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(TypedProblem problem, SchemaVersion version, int problemNumber)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", problemNumber));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("version", version.getLabel());
            pr.printRecord("problem", problemNumber);
            pr.printRecord("nOrbitals", problem.getNOrbitals());
            pr.printRecord("nElectrons", problem.getNElectrons());
            pr.printRecord("identityTerm", problem.getIdentityTerm());
            pr.printRecord("oneBodyTerms", problem.getOneBodyTerms().size());
            pr.printRecord("twoBodyTerms", problem.getTwoBodyTerms().size());
            pr.printRecord("initialStates", problem.getInitialStates().size());
            pr.printRecord("indexConvention", problem.getIndexConvention());
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code broombridge_oneBody_p=1.csv}
     * </p>
     *
     * @param kind 出力の識別子（oneBody/twoBody/initialStates/meta）
     * @param problemNumber 問題番号です
     * @return ファイル名です
     */
    static String buildFileName(String kind, int problemNumber) {
        return FILE_HEAD + "_" + kind + "_p=" + problemNumber + ".csv";
    }

    /**
     * 添字列を空白区切りの文字列にします。
     *
     * @param indices 添字列です
     * @return 文字列（例: {@code 0 1 1 0}）
     */
    private static String joinIndices(List<Integer> indices) {
        StringJoiner j = new StringJoiner(" ");
        for (Integer index : indices) {
            j.add(String.valueOf(index));
        }
        return j.toString();
    }

    /**
     * 演算子列をトークン表記の空白区切り文字列にします。
     *
     * @param operators 演算子列です
     * @return 文字列（例: {@code (1a)+ (2a)+}）
     */
    private static String joinOperators(List<LadderOperator> operators) {
        StringJoiner j = new StringJoiner(" ");
        for (LadderOperator op : operators) {
            j.add(op.toPolishNotation());
        }
        return j.toString();
    }
}
