package net.tearoff.v1.ledger.contracts;

import net.tearoff.v1.crypto.SecureHash;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StateRefTest {
    private static final String TX_ID = "SHA-256:6A1687C143DF792A011A1E80670A4E4E0C25D0D87A39514409B1ABFC2043581A";

    @Test
    public void parseReadsTheLastDelimiterAsIndex() {
        final StateRef stateRef = StateRef.parse(TX_ID + ":12");

        assertThat(stateRef.getTransactionId()).isEqualTo(SecureHash.parse(TX_ID));
        assertThat(stateRef.getIndex()).isEqualTo(12);
        assertThat(StateRef.parse(stateRef.toString())).isEqualTo(stateRef);
    }

    @Test
    public void parseRejectsMalformedValues() {
        assertThatThrownBy(() -> StateRef.parse("nothing")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delimiter is missing");
        assertThatThrownBy(() -> StateRef.parse(TX_ID + ":one")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index is malformed");
        assertThatThrownBy(() -> StateRef.parse("SHA-256:ZZ:1")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("transaction ID is malformed");
    }

    @Test
    public void negativeIndexIsRejected() {
        assertThatThrownBy(() -> new StateRef(SecureHash.parse(TX_ID), -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
