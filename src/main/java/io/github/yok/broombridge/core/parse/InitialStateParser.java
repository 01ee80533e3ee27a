package io.github.yok.broombridge.core.parse;

import io.github.yok.broombridge.core.document.ClusterOperator;
import io.github.yok.broombridge.core.document.StateSuggestion;
import io.github.yok.broombridge.core.exception.BroombridgeException;
import io.github.yok.broombridge.core.operator.IndexConvention;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 文書上の初期状態候補を {@link InputState} に変換するクラスです。
 *
 * <p>
 * method 名で種類を判定し、種類ごとに重ね合わせを組み立てます。 未知の method は UNRECOGNIZED として空の重ね合わせで返し、
 * ここでは例外にしません。
 * </p>
 */
public final class InitialStateParser {

    /**
     * トークン列の変換処理です。
     */
    private final TermListParser termListParser;

    /**
     * 変換処理を生成します。
     *
     * @param termListParser トークン列の変換処理です（null 不可）
     * @throws IllegalArgumentException termListParser が null の場合に発生します
     */
    public InitialStateParser(TermListParser termListParser) {
        if (termListParser == null) {
            throw new IllegalArgumentException("termListParser は null 不可です");
        }
        this.termListParser = termListParser;
    }

    /**
     * 初期状態候補を変換します。
     *
     * @param suggestion 初期状態候補です（null 不可）
     * @param indexConvention スピン軌道の添字規約です
     * @return 初期状態です
     * @throws BroombridgeException トークン列が不正な場合に発生します
     */
    public InputState parse(StateSuggestion suggestion, IndexConvention indexConvention) {
        if (suggestion == null) {
            throw new IllegalArgumentException("suggestion は null 不可です");
        }
        StateType type = StateType.fromMethod(suggestion.getMethod());

        List<AmplitudeTerm> superposition;
        switch (type) {
            case SPARSE_MULTI_CONFIGURATIONAL:
                superposition = parseSuperposition(suggestion.getSuperposition(), indexConvention);
                break;
            case UNITARY_COUPLED_CLUSTER:
                superposition = parseClusterOperator(suggestion, indexConvention);
                break;
            case SINGLE_CONFIGURATIONAL:
            case UNRECOGNIZED:
                superposition = Collections.emptyList();
                break;
            default:
                throw new IllegalStateException("未対応の初期状態の種類です: " + type);
        }
        return new InputState(suggestion.getLabel(), type, superposition);
    }

    /**
     * 多配置状態の各配置を変換します。
     *
     * @param configurations 配置のトークン列の一覧です（null は空として扱います）
     * @param indexConvention 添字規約です
     * @return 重ね合わせです
     */
    private List<AmplitudeTerm> parseSuperposition(List<List<String>> configurations,
            IndexConvention indexConvention) {
        List<AmplitudeTerm> terms = new ArrayList<>();
        if (configurations == null) {
            return terms;
        }
        for (List<String> configuration : configurations) {
            terms.add(termListParser.parseConfiguration(configuration, indexConvention));
        }
        return terms;
    }

    /**
     * UCC 状態のクラスター演算子を変換します。
     *
     * <p>
     * 1 体振幅、2 体振幅の順に並べ、最後に参照状態を置きます。 末尾が参照状態であることは利用側が前提とする並びです。
     * </p>
     *
     * @param suggestion 初期状態候補です
     * @param indexConvention 添字規約です
     * @return 重ね合わせです
     * @throws BroombridgeException cluster_operator が無い場合に発生します
     */
    private List<AmplitudeTerm> parseClusterOperator(StateSuggestion suggestion,
            IndexConvention indexConvention) {
        ClusterOperator cluster = suggestion.getClusterOperator();
        if (cluster == null) {
            throw new BroombridgeException(
                    "UCC 初期状態には cluster_operator が必要です: '" + suggestion.getLabel() + "'",
                    suggestion.getLabel());
        }

        AmplitudeTerm reference =
                termListParser.parseConfiguration(cluster.getReferenceState(), indexConvention);

        List<AmplitudeTerm> terms = new ArrayList<>();
        addClusterAmplitudes(terms, cluster.getOneBodyAmplitudes(), indexConvention);
        addClusterAmplitudes(terms, cluster.getTwoBodyAmplitudes(), indexConvention);
        terms.add(reference);
        return terms;
    }

    /**
     * クラスター振幅を変換して追加します。
     *
     * @param terms 追加先です
     * @param amplitudes クラスター振幅のトークン列の一覧です（null は空として扱います）
     * @param indexConvention 添字規約です
     */
    private void addClusterAmplitudes(List<AmplitudeTerm> terms, List<List<String>> amplitudes,
            IndexConvention indexConvention) {
        if (amplitudes == null) {
            return;
        }
        for (List<String> amplitude : amplitudes) {
            terms.add(termListParser.parseClusterAmplitude(amplitude, indexConvention));
        }
    }
}
