package io.github.yok.broombridge.core.exception;

/**
 * 対応していないスキーマバージョン文字列を検出した場合の例外です。
 */
public class InvalidVersionException extends BroombridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param version 不正なバージョン文字列です
     */
    public InvalidVersionException(String version) {
        super("対応していない Broombridge バージョンです: '" + version + "'", version);
    }
}
