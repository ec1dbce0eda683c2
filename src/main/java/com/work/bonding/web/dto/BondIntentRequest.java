package com.work.bonding.web.dto;

import com.work.bonding.core.model.BondIntent;
import com.work.bonding.core.model.PoolId;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

/**
 * bond 意图，add / requestUnbond / unbond / replace 共用。
 */
public class BondIntentRequest {

    @NotNull(message = "amount 不能为空")
    @PositiveOrZero(message = "amount 不能为负数")
    private BigInteger amount;

    @NotBlank(message = "poolId 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "poolId 必须是 0x 开头的 32 字节十六进制")
    private String poolId;

    @NotNull(message = "nonce 不能为空")
    @PositiveOrZero(message = "nonce 不能为负数")
    private BigInteger nonce;

    public BondIntent toIntent() {
        return new BondIntent(amount, PoolId.fromHex(poolId), nonce);
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public void setNonce(BigInteger nonce) {
        this.nonce = nonce;
    }
}
