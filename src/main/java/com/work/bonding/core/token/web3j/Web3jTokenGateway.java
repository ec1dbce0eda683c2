package com.work.bonding.core.token.web3j;

import com.work.bonding.core.exception.TokenTransferException;
import com.work.bonding.core.token.TokenGateway;
import com.work.bonding.core.token.TokenReturnData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * 基于 Web3j 的 ERC-20 转账实现，由账本托管账户签名发送：
 * 1. 先 eth_call 预执行，按 {@link TokenReturnData} 的兼容规则判定返回值（revert / 返回 false 直接失败）
 * 2. 再发送交易并等待 receipt，status 非 0x1 视为失败
 *
 * 注意：链上转账一旦被打包，无法随本地事务回滚。
 */
public class Web3jTokenGateway implements TokenGateway {

    private static final Logger log = LoggerFactory.getLogger(Web3jTokenGateway.class);

    private final Web3j web3j;
    private final TransactionManager transactionManager;
    private final TransactionReceiptProcessor receiptProcessor;
    private final BigInteger gasPrice;
    private final BigInteger gasLimit;

    public Web3jTokenGateway(Web3j web3j,
                             TransactionManager transactionManager,
                             TransactionReceiptProcessor receiptProcessor,
                             BigInteger gasPrice,
                             BigInteger gasLimit) {
        this.web3j = web3j;
        this.transactionManager = transactionManager;
        this.receiptProcessor = receiptProcessor;
        this.gasPrice = gasPrice;
        this.gasLimit = gasLimit;
    }

    @Override
    public void transferFrom(String token, String from, String to, BigInteger amount) {
        Function function = new Function("transferFrom",
                Arrays.<Type>asList(new Address(from), new Address(to), new Uint256(amount)),
                Collections.emptyList());
        execute(token, function, "transferFrom from=" + from + " to=" + to + " amount=" + amount);
    }

    @Override
    public void transfer(String token, String to, BigInteger amount) {
        Function function = new Function("transfer",
                Arrays.<Type>asList(new Address(to), new Uint256(amount)),
                Collections.emptyList());
        execute(token, function, "transfer to=" + to + " amount=" + amount);
    }

    private void execute(String token, Function function, String description) {
        String data = FunctionEncoder.encode(function);
        try {
            simulate(token, data, description);

            EthSendTransaction sent = transactionManager.sendTransaction(gasPrice, gasLimit, token, data, BigInteger.ZERO);
            if (sent.hasError()) {
                throw new TokenTransferException("发送转账交易失败: " + description + " err=" + sent.getError().getMessage());
            }
            TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(sent.getTransactionHash());
            if (!receipt.isStatusOK()) {
                throw new TokenTransferException("转账交易执行失败: " + description + " txHash=" + receipt.getTransactionHash());
            }
        } catch (IOException | TransactionException e) {
            log.warn("Web3j token transfer failed. token={} {} err={}", token, description, e.getMessage());
            throw new TokenTransferException("转账 RPC 异常: " + description, e);
        }
    }

    private void simulate(String token, String data, String description) throws IOException {
        EthCall call = web3j.ethCall(
                Transaction.createEthCallTransaction(transactionManager.getFromAddress(), token, data),
                DefaultBlockParameterName.LATEST).send();
        if (call.hasError()) {
            throw new TokenTransferException("转账预执行 revert: " + description + " err=" + call.getError().getMessage());
        }
        if (!TokenReturnData.isSuccess(call.getValue())) {
            throw new TokenTransferException("代币返回转账失败: " + description + " return=" + call.getValue());
        }
    }
}
