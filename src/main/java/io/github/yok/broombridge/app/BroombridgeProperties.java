package io.github.yok.broombridge.app;

import io.github.yok.broombridge.core.operator.IndexConvention;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * broombridge-loader の設定値（broombridge.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "broombridge")
public class BroombridgeProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * スピン軌道の添字規約です。
     */
    @NotNull
    private IndexConvention indexConvention = IndexConvention.UP_DOWN;

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "broombridge")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(128).append(nl);

        appendSection(sb, nl, "input",
                // path: 読み込む Broombridge 文書
                "path", getInput().getPath());

        appendSection(sb, nl, "indexConvention",
                // value: UP_DOWN / HALF_UP
                "value", getIndexConvention());

        appendSection(sb, nl, "output",
                // enabled: CSV を出力するかどうか
                "enabled", getOutput().isEnabled(),
                // dir: 出力先ディレクトリ
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 読み込む Broombridge 文書（YAML）のパスです。
         */
        @NotBlank
        private String path;
    }

    @Data
    public static class Output {

        /**
         * CSV を出力するかどうかです。
         */
        private boolean enabled = true;

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
