package com.work.bonding.config;

import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.support.ValidationUtils;
import com.work.bonding.core.token.TokenGateway;
import com.work.bonding.core.token.web3j.Web3jTokenGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

import java.time.Duration;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用，由托管账户私钥签名 ERC-20 转账。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    /**
     * 单笔账本操作最多发起的转账数（replaceBond：返还、销毁、建新仓）。
     */
    static final int MAX_TRANSFERS_PER_OPERATION = 3;

    @Bean
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public TokenGateway web3jTokenGateway(Web3j web3j, ChainProperties properties, BondingConfig config) {
        Credentials credentials = Credentials.create(
                ValidationUtils.requireNonEmpty(properties.getCustodyPrivateKey(), "chain.custodyPrivateKey"));
        String custody = ValidationUtils.requireAddress(credentials.getAddress(), "custodyAddress");
        if (!custody.equals(config.getInstanceAddress())) {
            throw new IllegalStateException("托管私钥地址与 bonding.instance-address 不一致: " + custody);
        }
        requireTimeoutCoversReceiptWait(config.getTransactionTimeout(), properties);
        RawTransactionManager transactionManager = new RawTransactionManager(web3j, credentials, properties.getChainId());
        PollingTransactionReceiptProcessor receiptProcessor = new PollingTransactionReceiptProcessor(web3j,
                properties.getReceiptPollInterval().toMillis(), properties.getReceiptPollAttempts());
        return new Web3jTokenGateway(web3j, transactionManager, receiptProcessor,
                properties.getGasPrice(), properties.getGasLimit());
    }

    /**
     * 事务时限短于转账等待 receipt 的最长时间时拒绝启动：否则转账上链后事务才超时回滚，
     * 托管余额与账本记录会对不上。
     */
    static void requireTimeoutCoversReceiptWait(Duration transactionTimeout, ChainProperties properties) {
        Duration worstCase = properties.getReceiptPollInterval()
                .multipliedBy(properties.getReceiptPollAttempts())
                .multipliedBy(MAX_TRANSFERS_PER_OPERATION);
        if (transactionTimeout.compareTo(worstCase) <= 0) {
            throw new IllegalStateException("bonding.transaction-timeout=" + transactionTimeout
                    + " 必须大于转账最长等待时间 " + worstCase
                    + "（receipt-poll-interval × receipt-poll-attempts × " + MAX_TRANSFERS_PER_OPERATION + "）");
        }
    }
}
