package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 初期状態の候補（文書上の記述そのもの）です。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StateSuggestion {

    private String label;

    /**
     * 初期状態の作り方（例: {@code sparse_multi_configurational}）です。
     */
    private String method;

    private Quantity energy;

    /**
     * 多配置状態の各配置のトークン列（振幅・演算子トークン・末尾マーカー）です。
     */
    private List<List<String>> superposition = new ArrayList<>();

    @JsonProperty("cluster_operator")
    private ClusterOperator clusterOperator;
}
