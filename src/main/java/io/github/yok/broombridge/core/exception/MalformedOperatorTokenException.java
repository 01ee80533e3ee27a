package io.github.yok.broombridge.core.exception;

/**
 * 演算子トークン（例: {@code (1a)+}）として解釈できない文字列を検出した場合の例外です。
 */
public class MalformedOperatorTokenException extends BroombridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param token 不正なトークンです
     */
    public MalformedOperatorTokenException(String token) {
        super("演算子トークンとして不正です: '" + token + "'", token);
    }

    /**
     * 原因例外付きで例外を生成します。
     *
     * @param token 不正なトークンです
     * @param cause 原因例外です
     */
    public MalformedOperatorTokenException(String token, Throwable cause) {
        super("演算子トークンとして不正です: '" + token + "'", token, cause);
    }
}
