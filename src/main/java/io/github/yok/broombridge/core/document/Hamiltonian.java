package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * ハミルトニアンの積分表です。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Hamiltonian {

    @JsonProperty("one_electron_integrals")
    private IntegralTable oneElectronIntegrals = new IntegralTable();

    @JsonProperty("two_electron_integrals")
    private IntegralTable twoElectronIntegrals = new IntegralTable();
}
