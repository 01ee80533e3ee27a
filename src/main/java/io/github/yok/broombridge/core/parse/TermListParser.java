package io.github.yok.broombridge.core.parse;

import io.github.yok.broombridge.core.exception.AmplitudeFormatException;
import io.github.yok.broombridge.core.exception.BroombridgeException;
import io.github.yok.broombridge.core.operator.FermionTerm;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.operator.LadderOperator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 振幅と演算子トークンの列を、振幅とフェルミオン項の組に変換するクラスです。
 *
 * <p>
 * 配置（{@code [振幅, トークン..., 末尾マーカー]}）は正規順序化して振幅を確定させます。 クラスター振幅（{@code [振幅, トークン...]}）は
 * 正規順序化せずにそのまま返します。
 * </p>
 */
@Slf4j
public final class TermListParser {

    /**
     * 演算子トークンの解読器です。
     */
    private final OperatorTokenDecoder decoder;

    /**
     * 変換処理を生成します。
     *
     * @param decoder 演算子トークンの解読器です（null 不可）
     * @throws IllegalArgumentException decoder が null の場合に発生します
     */
    public TermListParser(OperatorTokenDecoder decoder) {
        if (decoder == null) {
            throw new IllegalArgumentException("decoder は null 不可です");
        }
        this.decoder = decoder;
    }

    /**
     * 配置のトークン列を変換します。
     *
     * <p>
     * 先頭は振幅、末尾は構造上のマーカー（例: {@code |vacuum>}）で、その間を演算子トークンとして順に解読します。
     * 正規順序化の結果、消滅演算子を含まない項がちょうど 1 つ残った場合、その項の係数を振幅とし、項の係数は 1.0 に戻します。
     * それ以外（0 個または複数）の場合、振幅は 0.0 とし、項は組み立てたままの演算子列（係数 1.0）を返します。
     * </p>
     *
     * @param tokens トークン列です（2 個以上）
     * @param indexConvention スピン軌道の添字規約です
     * @return 振幅（虚部は 0.0）と項の組です
     * @throws AmplitudeFormatException 振幅が実数として解釈できない場合に発生します
     * @throws io.github.yok.broombridge.core.exception.MalformedOperatorTokenException 演算子トークンが不正な場合に発生します
     */
    public AmplitudeTerm parseConfiguration(List<String> tokens, IndexConvention indexConvention) {
        if (tokens == null || tokens.size() < 2) {
            throw new BroombridgeException("配置には振幅と末尾マーカーが必要です: " + tokens,
                    String.valueOf(tokens));
        }
        double amplitude = parseAmplitude(tokens.get(0));
        List<LadderOperator> operators =
                decodeOperators(tokens.subList(1, tokens.size() - 1), indexConvention);

        FermionTerm term = new FermionTerm(operators, amplitude);

        List<FermionTerm> created = new ArrayList<>();
        for (FermionTerm t : term.canonicalOrder()) {
            if (!t.containsAnnihilation()) {
                created.add(t);
            }
        }

        double finalAmplitude = 0.0;
        if (created.size() == 1) {
            term = created.get(0);
            finalAmplitude = term.getCoefficient();
        } else {
            log.warn("配置が単一の生成状態になりませんでした（残った項の数={}）。振幅を 0.0 とします: {}", created.size(),
                    tokens);
        }
        return new AmplitudeTerm(finalAmplitude, 0.0, term.withCoefficient(1.0));
    }

    /**
     * クラスター振幅のトークン列を変換します。
     *
     * <p>
     * 先頭は振幅、残りはすべて演算子トークンです。 正規順序化は行いません。
     * </p>
     *
     * @param tokens トークン列です（1 個以上）
     * @param indexConvention スピン軌道の添字規約です
     * @return 振幅（項の係数、虚部は 0.0）と項の組です
     * @throws AmplitudeFormatException 振幅が実数として解釈できない場合に発生します
     * @throws io.github.yok.broombridge.core.exception.MalformedOperatorTokenException 演算子トークンが不正な場合に発生します
     */
    public AmplitudeTerm parseClusterAmplitude(List<String> tokens,
            IndexConvention indexConvention) {
        if (tokens == null || tokens.isEmpty()) {
            throw new BroombridgeException("クラスター振幅には振幅が必要です: " + tokens,
                    String.valueOf(tokens));
        }
        double amplitude = parseAmplitude(tokens.get(0));
        List<LadderOperator> operators =
                decodeOperators(tokens.subList(1, tokens.size()), indexConvention);

        FermionTerm term = new FermionTerm(operators, amplitude);
        return new AmplitudeTerm(term.getCoefficient(), 0.0, term);
    }

    /**
     * 演算子トークンを順に解読します。
     *
     * @param tokens 演算子トークンの列です
     * @param indexConvention 添字規約です
     * @return 演算子列です
     */
    private List<LadderOperator> decodeOperators(List<String> tokens,
            IndexConvention indexConvention) {
        List<LadderOperator> operators = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            operators.add(decoder.decode(token, indexConvention));
        }
        return operators;
    }

    /**
     * 振幅トークンを実数に変換します。
     *
     * <p>
     * ロケールに依存しない 10 進表記（{@link BigDecimal} の文字列表現）として解釈します。
     * </p>
     *
     * @param token 振幅トークンです
     * @return 振幅です
     * @throws AmplitudeFormatException 解釈できない場合に発生します
     */
    static double parseAmplitude(String token) {
        if (token == null) {
            throw new AmplitudeFormatException(null, new NumberFormatException("null"));
        }
        try {
            return new BigDecimal(token.trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw new AmplitudeFormatException(token, e);
        }
    }
}
