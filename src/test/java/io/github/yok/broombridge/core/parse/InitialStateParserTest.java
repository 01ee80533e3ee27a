package io.github.yok.broombridge.core.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.broombridge.core.document.ClusterOperator;
import io.github.yok.broombridge.core.document.StateSuggestion;
import io.github.yok.broombridge.core.exception.BroombridgeException;
import io.github.yok.broombridge.core.exception.MalformedOperatorTokenException;
import io.github.yok.broombridge.core.exception.UnsupportedStateMethodException;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.operator.LadderOperator;
import io.github.yok.broombridge.core.operator.Spin;
import io.github.yok.broombridge.core.operator.SpinOrbital;
import java.util.List;
import org.junit.jupiter.api.Test;

final class InitialStateParserTest {

    private final InitialStateParser parser =
            new InitialStateParser(new TermListParser(new OperatorTokenDecoder()));

    private static StateSuggestion suggestion(String label, String method) {
        StateSuggestion s = new StateSuggestion();
        s.setLabel(label);
        s.setMethod(method);
        return s;
    }

    private static LadderOperator create(int orbital) {
        return new LadderOperator(true, new SpinOrbital(orbital, Spin.UP, IndexConvention.UP_DOWN));
    }

    @Test
    void unitaryCoupledClusterPutsReferenceLast() {
        ClusterOperator cluster = new ClusterOperator();
        cluster.setReferenceState(List.of("1.0", "(1a)+", "(2a)+", "|vacuum>"));
        cluster.setOneBodyAmplitudes(List.of(List.of("0.1", "(1a)+", "(3a)+")));
        cluster.setTwoBodyAmplitudes(List.of());

        StateSuggestion s = suggestion("UCCSD", "unitary_coupled_cluster");
        s.setClusterOperator(cluster);

        InputState state = parser.parse(s, IndexConvention.UP_DOWN);

        assertEquals(StateType.UNITARY_COUPLED_CLUSTER, state.getType());
        List<AmplitudeTerm> superposition = state.requireSuperposition();
        assertEquals(2, superposition.size());

        AmplitudeTerm oneBody = superposition.get(0);
        assertEquals(0.1, oneBody.getReal());
        assertEquals(List.of(create(0), create(2)), oneBody.getTerm().getOperators());

        AmplitudeTerm reference = superposition.get(1);
        assertEquals(1.0, reference.getReal());
        assertEquals(1.0, reference.getTerm().getCoefficient());
        assertEquals(List.of(create(0), create(1)), reference.getTerm().getOperators());
    }

    @Test
    void unitaryCoupledClusterOrdersOneBodyThenTwoBodyThenReference() {
        ClusterOperator cluster = new ClusterOperator();
        cluster.setReferenceState(List.of("1.0", "(1a)+", "(1b)+", "|vacuum>"));
        cluster.setOneBodyAmplitudes(
                List.of(List.of("0.01", "(2a)+", "(1a)"), List.of("0.02", "(2b)+", "(1b)")));
        cluster.setTwoBodyAmplitudes(List.of(List.of("-0.3", "(2a)+", "(2b)+", "(1b)", "(1a)")));

        StateSuggestion s = suggestion("UCCSD", "Unitary_Coupled_Cluster");
        s.setClusterOperator(cluster);

        List<AmplitudeTerm> superposition =
                parser.parse(s, IndexConvention.UP_DOWN).requireSuperposition();

        assertEquals(4, superposition.size());
        assertEquals(0.01, superposition.get(0).getReal());
        assertEquals(0.02, superposition.get(1).getReal());
        assertEquals(-0.3, superposition.get(2).getReal());
        assertEquals(2, superposition.get(3).getTerm().getOperators().size());
        assertEquals(1.0, superposition.get(3).getReal());
    }

    @Test
    void unitaryCoupledClusterRequiresClusterOperator() {
        BroombridgeException e = assertThrows(BroombridgeException.class,
                () -> parser.parse(suggestion("bad", "unitary_coupled_cluster"),
                        IndexConvention.UP_DOWN));
        assertEquals("bad", e.getRawValue());
    }

    @Test
    void sparseMultiConfigurationalParsesEachConfiguration() {
        StateSuggestion s = suggestion("|G>", "SPARSE_MULTI_CONFIGURATIONAL");
        s.setSuperposition(List.of(List.of("0.9", "(1a)+", "(2a)+", "|vacuum>"),
                List.of("0.1", "(3a)+", "(1a)+", "|vacuum>")));

        InputState state = parser.parse(s, IndexConvention.UP_DOWN);

        assertEquals(StateType.SPARSE_MULTI_CONFIGURATIONAL, state.getType());
        assertEquals("|G>", state.getLabel());
        assertEquals(2, state.getSuperposition().size());
        assertEquals(0.9, state.getSuperposition().get(0).getReal());
        assertEquals(-0.1, state.getSuperposition().get(1).getReal());
        assertEquals(List.of(create(0), create(2)),
                state.getSuperposition().get(1).getTerm().getOperators());
    }

    @Test
    void malformedTokenAbortsTheState() {
        StateSuggestion s = suggestion("|G>", "sparse_multi_configurational");
        s.setSuperposition(List.of(List.of("1.0", "(1q)+", "|vacuum>")));
        assertThrows(MalformedOperatorTokenException.class,
                () -> parser.parse(s, IndexConvention.UP_DOWN));
    }

    @Test
    void singleConfigurationalHasNoSuperposition() {
        InputState state =
                parser.parse(suggestion("HF", "single_configurational"), IndexConvention.UP_DOWN);

        assertEquals(StateType.SINGLE_CONFIGURATIONAL, state.getType());
        assertTrue(state.getSuperposition().isEmpty());
        assertThrows(UnsupportedStateMethodException.class, state::requireSuperposition);
    }

    @Test
    void unknownMethodIsUnrecognizedNotAnError() {
        InputState state = parser.parse(suggestion("x", "coupled_cluster_of_the_future"),
                IndexConvention.UP_DOWN);

        assertEquals(StateType.UNRECOGNIZED, state.getType());
        assertTrue(state.getSuperposition().isEmpty());

        UnsupportedStateMethodException e =
                assertThrows(UnsupportedStateMethodException.class, state::requireSuperposition);
        assertEquals("x", e.getRawValue());
    }

    @Test
    void missingMethodIsUnrecognized() {
        assertEquals(StateType.UNRECOGNIZED,
                parser.parse(suggestion("x", null), IndexConvention.UP_DOWN).getType());
    }
}
