package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 1 電子積分または 2 電子積分の疎な表です。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntegralTable {

    private String format;

    private String units;

    /**
     * 2 電子積分の添字規約名（例: {@code mulliken}）です。
     */
    @JsonProperty("index_convention")
    private String indexConvention;

    /**
     * 行の一覧です（各行は {@code [i, j, ..., value]}）。
     */
    private List<List<Double>> values = new ArrayList<>();

    /**
     * 各行を積分表の行に変換して返します。
     *
     * @return 積分表の行の一覧です
     */
    public List<IntegralEntry> entries() {
        List<IntegralEntry> entries = new ArrayList<>();
        if (values == null) {
            return entries;
        }
        for (List<Double> row : values) {
            entries.add(IntegralEntry.fromRow(row));
        }
        return entries;
    }
}
