package com.work.bonding.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

/**
 * mock 代币的 mint / approve 请求，account 分别表示收款人 / 授权人。
 */
public class MockTokenRequest {

    @NotBlank(message = "account 不能为空")
    private String account;

    @NotNull(message = "amount 不能为空")
    @PositiveOrZero(message = "amount 不能为负数")
    private BigInteger amount;

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
