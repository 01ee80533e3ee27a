package io.github.yok.broombridge.core.exception;

import lombok.Getter;

/**
 * Broombridge 文書の変換中に検出した入力不正を表す例外です。
 *
 * <p>
 * 診断のため、原因となった入力値（トークン文字列・ラベル・バージョン文字列など）を保持します。
 * </p>
 */
@Getter
public class BroombridgeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 原因となった入力値です（不明な場合は null）。
     */
    private final String rawValue;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     * @param rawValue 原因となった入力値です
     */
    public BroombridgeException(String message, String rawValue) {
        super(message);
        this.rawValue = rawValue;
    }

    /**
     * 原因例外付きで例外を生成します。
     *
     * @param message メッセージです
     * @param rawValue 原因となった入力値です
     * @param cause 原因例外です
     */
    public BroombridgeException(String message, String rawValue, Throwable cause) {
        super(message, cause);
        this.rawValue = rawValue;
    }
}
