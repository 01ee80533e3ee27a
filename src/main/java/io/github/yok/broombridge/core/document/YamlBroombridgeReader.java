package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Jackson（YAML）で Broombridge 文書を読み込むクラスです。
 *
 * <p>
 * 未知の項目は無視します。 トークン列中のスカラー値は文書上の表記のまま文字列として受け取ります。
 * </p>
 */
@Slf4j
public final class YamlBroombridgeReader implements BroombridgeReader {

    /**
     * YAML 用の ObjectMapper です。
     */
    private final ObjectMapper yamlMapper;

    /**
     * 読み込み処理を生成します。
     */
    public YamlBroombridgeReader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 文書を読み込みます。
     *
     * @param path 文書ファイルのパスです（null 不可）
     * @return 読み込んだ文書です
     * @throws IllegalArgumentException path が null の場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    @Override
    public BroombridgeDocument read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path は null 不可です");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            BroombridgeDocument document = yamlMapper.readValue(reader, BroombridgeDocument.class);
            if (document == null) {
                throw new IllegalStateException("Broombridge 文書が空です: " + path);
            }
            log.info("Broombridge 文書を読み込みました。ファイル={}、バージョン={}、問題数={}", path,
                    document.getFormat() == null ? null : document.getFormat().getVersion(),
                    document.getProblemDescriptions() == null ? 0
                            : document.getProblemDescriptions().size());
            return document;
        } catch (IOException e) {
            throw new IllegalStateException("Broombridge 文書の読み込みに失敗しました: " + path, e);
        }
    }
}
