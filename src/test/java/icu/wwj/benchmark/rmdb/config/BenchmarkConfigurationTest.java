package icu.wwj.benchmark.rmdb.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BenchmarkConfigurationTest {
    
    private static Properties props(String... keyValues) {
        Properties result = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            result.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return result;
    }
    
    @Test
    void assertDefaults() {
        BenchmarkConfiguration actual = new BenchmarkConfiguration(new Properties());
        assertEquals("localhost", actual.getHost());
        assertEquals(8765, actual.getPort());
        assertEquals(1, actual.getWarehouses());
        assertEquals(1, actual.getTerminals());
        assertEquals(100, actual.getTransactionsPerTerminal());
        assertEquals(0.5, actual.getReadWriteRatio());
        assertFalse(actual.isTerminalWarehouseFixed());
        assertNull(actual.getSeed());
        assertNull(actual.getResultFile());
        assertArrayEquals(new double[]{0.45, 0.43, 0.04, 0.04, 0.04}, actual.getTransactionWeights());
        assertDoesNotThrow(actual::validate);
    }
    
    @Test
    void assertOverridesWin() {
        BenchmarkConfiguration actual = new BenchmarkConfiguration(props("terminals", "4", "seed", "99", "port", "9000"), props("terminals", "8"));
        assertEquals(8, actual.getTerminals());
        assertEquals(9000, actual.getPort());
        assertEquals(99L, actual.getSeed());
    }
    
    @Test
    void assertInvalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfiguration(props("readWriteRatio", "1.5")).validate());
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfiguration(props("terminals", "0")).validate());
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfiguration(props("paymentWeight", "-0.1")).validate());
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkConfiguration(props("newOrderWeight", "0", "paymentWeight", "0",
                "deliveryWeight", "0", "orderStatusWeight", "0", "stockLevelWeight", "0")).validate());
        assertThrows(NumberFormatException.class, () -> new BenchmarkConfiguration(props("port", "http")));
    }
}
