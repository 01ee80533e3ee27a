package io.github.yok.broombridge.app;

import io.github.yok.broombridge.core.document.BroombridgeReader;
import io.github.yok.broombridge.core.document.YamlBroombridgeReader;
import io.github.yok.broombridge.core.parse.InitialStateParser;
import io.github.yok.broombridge.core.parse.OperatorTokenDecoder;
import io.github.yok.broombridge.core.parse.TermListParser;
import io.github.yok.broombridge.core.problem.ProblemExtractor;
import io.github.yok.broombridge.out.CsvProblemSummaryWriter;
import io.github.yok.broombridge.out.ProblemSummaryWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 文書の読み込みから型付けまでの Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class BroombridgeLoaderConfiguration {

    /**
     * broombridge-loader の設定値（broombridge.*）です。
     */
    private final BroombridgeProperties p;

    /**
     * 文書の読み込み処理を生成します。
     *
     * @return 読み込み処理です
     */
    @Bean
    public BroombridgeReader broombridgeReader() {
        return new YamlBroombridgeReader();
    }

    /**
     * 演算子トークンの解読器を生成します。
     *
     * @return 解読器です
     */
    @Bean
    public OperatorTokenDecoder operatorTokenDecoder() {
        return new OperatorTokenDecoder();
    }

    /**
     * トークン列の変換処理を生成します。
     *
     * @param decoder 演算子トークンの解読器です
     * @return 変換処理です
     */
    @Bean
    public TermListParser termListParser(OperatorTokenDecoder decoder) {
        return new TermListParser(decoder);
    }

    /**
     * 初期状態の変換処理を生成します。
     *
     * @param termListParser トークン列の変換処理です
     * @return 変換処理です
     */
    @Bean
    public InitialStateParser initialStateParser(TermListParser termListParser) {
        return new InitialStateParser(termListParser);
    }

    /**
     * 問題記述の抽出処理を生成します。
     *
     * @param initialStateParser 初期状態の変換処理です
     * @return 抽出処理です
     */
    @Bean
    public ProblemExtractor problemExtractor(InitialStateParser initialStateParser) {
        return new ProblemExtractor(initialStateParser);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ProblemSummaryWriter problemSummaryWriter() {
        return new CsvProblemSummaryWriter(p.getOutput().getDir());
    }
}
