package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 電子状態問題の記述（1 問題分）です。
 *
 * <p>
 * 軌道添字は文書の規約どおり 1 始まりのまま保持します。
 * </p>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProblemDescription {

    @JsonProperty("n_orbitals")
    private int nOrbitals;

    @JsonProperty("n_electrons")
    private int nElectrons;

    @JsonProperty("coulomb_repulsion")
    private Quantity coulombRepulsion;

    @JsonProperty("energy_offset")
    private Quantity energyOffset;

    private Hamiltonian hamiltonian = new Hamiltonian();

    @JsonProperty("initial_state_suggestions")
    private List<StateSuggestion> initialStateSuggestions = new ArrayList<>();
}
