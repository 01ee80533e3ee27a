package io.github.yok.broombridge.core.document;

import java.nio.file.Path;

/**
 * Broombridge 文書を読み込む処理のインタフェースです。
 */
public interface BroombridgeReader {

    /**
     * 文書を読み込みます。
     *
     * @param path 文書ファイルのパスです
     * @return 読み込んだ文書です
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    BroombridgeDocument read(Path path);
}
