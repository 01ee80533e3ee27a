package io.github.yok.broombridge.core.parse;

import io.github.yok.broombridge.core.exception.MalformedOperatorTokenException;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.operator.LadderOperator;
import io.github.yok.broombridge.core.operator.Spin;
import io.github.yok.broombridge.core.operator.SpinOrbital;

/**
 * 演算子トークン（例: {@code (1a)+}, {@code (3b)}）を解読するクラスです。
 *
 * <p>
 * 文法は「{@code (}・1 桁以上の数字（1 始まりの軌道番号）・スピン文字（a=up, b=down）・{@code )}・0 個以上の
 * {@code +}」です。 {@code +} が 1 個以上あれば生成演算子、無ければ消滅演算子です。 {@code +} の個数は 2 個以上でも 1
 * 個と同じ扱いです。
 * </p>
 *
 * <p>
 * {@code (数字 スピン)} の部分がトークン中のどこかに見つかれば、その前後にある他の文字は無視します。
 * </p>
 */
public final class OperatorTokenDecoder {

    private static final char OPEN = '(';

    private static final char CLOSE = ')';

    private static final char CREATION = '+';

    /**
     * トークンを解読します。
     *
     * @param token 演算子トークンです
     * @param indexConvention スピン軌道の添字規約です（null 不可）
     * @return 生成/消滅の別と 0 始まりのスピン軌道です
     * @throws MalformedOperatorTokenException トークンが文法に合わない場合に発生します
     */
    public LadderOperator decode(String token, IndexConvention indexConvention) {
        if (indexConvention == null) {
            throw new IllegalArgumentException("indexConvention は null 不可です");
        }
        if (token == null) {
            throw new MalformedOperatorTokenException(null);
        }

        for (int start = token.indexOf(OPEN); start >= 0; start = token.indexOf(OPEN, start + 1)) {
            LadderOperator op = scanAt(token, start, indexConvention);
            if (op != null) {
                return op;
            }
        }
        throw new MalformedOperatorTokenException(token);
    }

    /**
     * 指定位置の {@code (} から 1 つの演算子を読み取ります。
     *
     * @param token トークンです
     * @param start {@code (} の位置です
     * @param indexConvention 添字規約です
     * @return 演算子です（この位置で文法に合わない場合は null）
     * @throws MalformedOperatorTokenException 軌道番号が 0 または桁あふれの場合に発生します
     */
    private static LadderOperator scanAt(String token, int start, IndexConvention indexConvention) {
        int pos = start + 1;

        // 数字の並び
        int digitsStart = pos;
        while (pos < token.length() && isAsciiDigit(token.charAt(pos))) {
            pos++;
        }
        if (pos == digitsStart || pos >= token.length()) {
            return null;
        }
        String digits = token.substring(digitsStart, pos);

        // スピン文字
        Spin spin = Spin.fromLetter(token.charAt(pos));
        if (spin == null) {
            return null;
        }
        pos++;

        if (pos >= token.length() || token.charAt(pos) != CLOSE) {
            return null;
        }
        pos++;

        // 生成マーカーの並び（1 個以上で生成演算子）
        boolean creation = pos < token.length() && token.charAt(pos) == CREATION;

        int oneBased = parseOrbital(token, digits);
        return new LadderOperator(creation, new SpinOrbital(oneBased - 1, spin, indexConvention));
    }

    /**
     * 1 始まりの軌道番号を読み取ります。
     *
     * @param token トークン全体です（例外用）
     * @param digits 数字の並びです
     * @return 1 以上の軌道番号です
     * @throws MalformedOperatorTokenException 0 または int に収まらない場合に発生します
     */
    private static int parseOrbital(String token, String digits) {
        int orbital;
        try {
            orbital = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedOperatorTokenException(token, e);
        }
        if (orbital < 1) {
            throw new MalformedOperatorTokenException(token);
        }
        return orbital;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
