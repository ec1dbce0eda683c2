package com.work.bonding.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class Web3jConfigurationTest {

    @Test
    public void default_timeout_covers_default_receipt_wait() {
        assertDoesNotThrow(() -> Web3jConfiguration.requireTimeoutCoversReceiptWait(
                new BondingProperties().getTransactionTimeout(), new ChainProperties()));
    }

    @Test
    public void timeout_shorter_than_receipt_wait_is_rejected() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> Web3jConfiguration.requireTimeoutCoversReceiptWait(Duration.ofSeconds(10), new ChainProperties()));
        assertTrue(ex.getMessage().contains("bonding.transaction-timeout"));

        // 1s × 60 × 3 = 180s，等于上限也不够
        assertThrows(IllegalStateException.class,
                () -> Web3jConfiguration.requireTimeoutCoversReceiptWait(Duration.ofSeconds(180), new ChainProperties()));
    }

    @Test
    public void faster_polling_allows_shorter_timeout() {
        ChainProperties chain = new ChainProperties();
        chain.setReceiptPollInterval(Duration.ofMillis(500));
        chain.setReceiptPollAttempts(10);
        assertDoesNotThrow(() -> Web3jConfiguration.requireTimeoutCoversReceiptWait(Duration.ofSeconds(16), chain));
    }
}
