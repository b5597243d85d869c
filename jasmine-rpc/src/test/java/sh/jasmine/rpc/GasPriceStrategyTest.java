// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.jasmine.core.types.Wei;

@ExtendWith(MockitoExtension.class)
class GasPriceStrategyTest {

    @Mock
    private ChainClient client;

    @Test
    void rpcUsesTheSuggestedPrice() {
        when(client.suggestGasPrice()).thenReturn(CompletableFuture.completedFuture(Wei.gwei(12)));

        assertEquals(Wei.gwei(12), GasPriceStrategy.rpc().gasPrice(client).join());
    }

    @Test
    void fixedNeverQueriesTheNode() {
        assertEquals(Wei.gwei(5), GasPriceStrategy.fixed(Wei.gwei(5)).gasPrice(client).join());

        verify(client, never()).suggestGasPrice();
    }

    @Test
    void scaledRoundsDown() {
        when(client.suggestGasPrice()).thenReturn(CompletableFuture.completedFuture(Wei.of(1_000_000_001L)));

        assertEquals(Wei.of(1_200_000_001L), GasPriceStrategy.scaled(120, 100).gasPrice(client).join());
    }

    @Test
    void scaledRejectsNonPositiveFactors() {
        assertThrows(IllegalArgumentException.class, () -> GasPriceStrategy.scaled(0, 100));
        assertThrows(IllegalArgumentException.class, () -> GasPriceStrategy.scaled(1, -1));
    }
}
