package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Broombridge 文書のうち、本ツールが読み取る部分を保持するクラスです。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BroombridgeDocument {

    /**
     * 文書形式の情報です。
     */
    private Format format = new Format();

    /**
     * 問題記述の一覧です。
     */
    @JsonProperty("problem_description")
    private List<ProblemDescription> problemDescriptions = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Format {

        /**
         * スキーマバージョン文字列です。
         */
        private String version;
    }
}
