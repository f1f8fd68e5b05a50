package io.providerbridge.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderBridgeExceptionTest {

    @Test
    void wireNameRoundTripsToSameSubtype() {
        ProviderBridgeException original = new ProviderBridgeException.ContractViolation("parsed messages present");

        ProviderBridgeException rebuilt = ProviderBridgeException.fromWire(original.errorType(), original.getMessage());

        assertThat(rebuilt).isInstanceOf(ProviderBridgeException.ContractViolation.class);
        assertThat(rebuilt).hasMessage("parsed messages present");
    }

    @Test
    void unknownWireNameBecomesProviderFailure() {
        ProviderBridgeException rebuilt = ProviderBridgeException.fromWire("IOException", "disk gone");

        assertThat(rebuilt).isInstanceOf(ProviderBridgeException.ProviderFailure.class);
        assertThat(rebuilt).hasMessage("disk gone");
    }

    @Test
    void lifecycleErrorsKeepTheirType() {
        assertThat(ProviderBridgeException.fromWire("EndpointClosed", "closed"))
                .isInstanceOf(ProviderBridgeException.EndpointClosed.class);
        assertThat(ProviderBridgeException.fromWire("NotInitialized", "x"))
                .isInstanceOf(ProviderBridgeException.NotInitialized.class);
        assertThat(ProviderBridgeException.fromWire("AlreadyInitialized", "x"))
                .isInstanceOf(ProviderBridgeException.AlreadyInitialized.class);
    }
}
