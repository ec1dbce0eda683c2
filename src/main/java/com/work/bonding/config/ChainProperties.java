package com.work.bonding.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 链连接配置。
 *
 * mode=mock: 使用内存代币账本 InMemoryTokenLedger
 * mode=web3j: 使用 Web3jTokenGateway 调用链上 ERC-20
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    private long chainId = 1337L;

    /**
     * 托管账户私钥，对应地址必须与 bonding.instance-address 一致
     */
    private String custodyPrivateKey;

    private BigInteger gasPrice = BigInteger.valueOf(20_000_000_000L);

    private BigInteger gasLimit = BigInteger.valueOf(120_000L);

    private Duration receiptPollInterval = Duration.ofSeconds(1);

    private int receiptPollAttempts = 60;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public String getCustodyPrivateKey() {
        return custodyPrivateKey;
    }

    public void setCustodyPrivateKey(String custodyPrivateKey) {
        this.custodyPrivateKey = custodyPrivateKey;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public int getReceiptPollAttempts() {
        return receiptPollAttempts;
    }

    public void setReceiptPollAttempts(int receiptPollAttempts) {
        this.receiptPollAttempts = receiptPollAttempts;
    }
}
