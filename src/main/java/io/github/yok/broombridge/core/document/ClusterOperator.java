package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * ユニタリ結合クラスター（UCC）初期状態のクラスター演算子です。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterOperator {

    /**
     * 参照状態のトークン列（振幅・演算子トークン・末尾マーカー）です。
     */
    @JsonProperty("reference_state")
    private List<String> referenceState = new ArrayList<>();

    /**
     * 1 体クラスター振幅のトークン列の一覧（振幅・演算子トークン）です。
     */
    @JsonProperty("one_body_amplitudes")
    private List<List<String>> oneBodyAmplitudes = new ArrayList<>();

    /**
     * 2 体クラスター振幅のトークン列の一覧（振幅・演算子トークン）です。
     */
    @JsonProperty("two_body_amplitudes")
    private List<List<String>> twoBodyAmplitudes = new ArrayList<>();
}
