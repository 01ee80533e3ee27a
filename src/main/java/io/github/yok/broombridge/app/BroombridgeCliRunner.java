package io.github.yok.broombridge.app;

import io.github.yok.broombridge.core.document.BroombridgeDocument;
import io.github.yok.broombridge.core.document.BroombridgeReader;
import io.github.yok.broombridge.core.document.ProblemDescription;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.parse.InputState;
import io.github.yok.broombridge.core.problem.ProblemExtractor;
import io.github.yok.broombridge.core.problem.TypedProblem;
import io.github.yok.broombridge.core.version.SchemaVersion;
import io.github.yok.broombridge.core.version.VersionResolver;
import io.github.yok.broombridge.out.ProblemSummaryWriter;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で broombridge-loader を実行するクラスです。
 *
 * <p>
 * Broombridge 文書を読み込み、バージョンを判定したうえで各問題記述を型付けし、概要を表示・出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BroombridgeCliRunner implements CommandLineRunner {

    /**
     * broombridge-loader の設定値（broombridge.*）です。
     */
    private final BroombridgeProperties properties;

    /**
     * 文書の読み込み処理です。
     */
    private final BroombridgeReader reader;

    /**
     * 問題記述の抽出処理です。
     */
    private final ProblemExtractor problemExtractor;

    /**
     * 結果出力ロジックです。
     */
    private final ProblemSummaryWriter summaryWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== broombridge-loader start: load problem description ===");
        System.out.print(properties.toMultilineString());

        // broombridge.input.path の必須チェックは BroombridgeProperties のバインド時に行われます。
        String path = properties.getInput().getPath();
        BroombridgeDocument document = reader.read(Paths.get(path));
        String rawVersion = document.getFormat() == null ? null : document.getFormat().getVersion();
        SchemaVersion version = VersionResolver.resolve(rawVersion);

        List<ProblemDescription> problems = document.getProblemDescriptions();
        if (problems == null || problems.isEmpty()) {
            throw new IllegalStateException("problem_description が空です: " + path);
        }

        IndexConvention convention = properties.getIndexConvention();

        // 問題記述ごとに型付け
        for (int i = 0; i < problems.size(); i++) {
            int problemNumber = i + 1;
            TypedProblem typed = problemExtractor.extract(problems.get(i), convention);

            System.out.println("=== 問題ごとの変換 ===");
            System.out.println("入力: version=" + version.getLabel() + ", 問題=" + problemNumber + "/"
                    + problems.size() + "（添字規約=" + convention + "）");
            System.out.println("結果: 軌道数=" + typed.getNOrbitals() + ", 電子数=" + typed.getNElectrons()
                    + ", 恒等項=" + fmt5(typed.getIdentityTerm()));
            System.out.println("結果: 1電子積分=" + typed.getOneBodyTerms().size() + ", 2電子積分="
                    + typed.getTwoBodyTerms().size());
            for (InputState state : typed.getInitialStates().values()) {
                System.out.println("結果: 初期状態 " + state.getLabel() + " (" + state.getType()
                        + ", 項数=" + state.getSuperposition().size() + ")");
            }

            if (properties.getOutput().isEnabled()) {
                summaryWriter.write(typed, version, problemNumber);
            }
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
