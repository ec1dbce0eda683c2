package com.work.bonding.core.support;

import com.work.bonding.core.exception.TokenTransferException;
import com.work.bonding.core.token.TokenGateway;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.bonding.core.support.ValidationUtils.requireAddress;
import static com.work.bonding.core.support.ValidationUtils.requireNonNegative;

/**
 * 内存版 ERC-20 账本，仅用于 demo 与测试，真实部署请使用链上实现。
 * <p>
 * 余额与授权的修改都会登记到 {@link UndoJournal}，外层事务回滚时转账一并撤销。
 */
public class InMemoryTokenLedger implements TokenGateway {

    private static final class AllowanceKey {
        final String token;
        final String owner;
        final String spender;

        AllowanceKey(String token, String owner, String spender) {
            this.token = token;
            this.owner = owner;
            this.spender = spender;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            AllowanceKey that = (AllowanceKey) o;
            return token.equals(that.token) && owner.equals(that.owner) && spender.equals(that.spender);
        }

        @Override
        public int hashCode() {
            return Objects.hash(token, owner, spender);
        }
    }

    private final String custodyAddress;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<AllowanceKey, BigInteger> allowances = new ConcurrentHashMap<>();

    /**
     * @param custodyAddress 账本托管账户，transfer 从该账户出账，transferFrom 以它作为 spender
     */
    public InMemoryTokenLedger(String custodyAddress) {
        this.custodyAddress = requireAddress(custodyAddress, "custodyAddress");
    }

    public synchronized void mint(String token, String to, BigInteger amount) {
        credit(requireAddress(token, "token"), requireAddress(to, "to"), requireNonNegative(amount, "amount"));
    }

    public synchronized void approve(String token, String owner, String spender, BigInteger amount) {
        AllowanceKey key = new AllowanceKey(requireAddress(token, "token"),
                requireAddress(owner, "owner"), requireAddress(spender, "spender"));
        setAllowance(key, requireNonNegative(amount, "amount"));
    }

    public BigInteger balanceOf(String token, String account) {
        return balances.getOrDefault(balanceKey(requireAddress(token, "token"), requireAddress(account, "account")),
                BigInteger.ZERO);
    }

    @Override
    public synchronized void transferFrom(String token, String from, String to, BigInteger amount) {
        String t = requireAddress(token, "token");
        String f = requireAddress(from, "from");
        String r = requireAddress(to, "to");
        requireNonNegative(amount, "amount");

        AllowanceKey key = new AllowanceKey(t, f, custodyAddress);
        BigInteger allowance = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowance.compareTo(amount) < 0) {
            throw new TokenTransferException("授权额度不足: owner=" + f + " allowance=" + allowance + " amount=" + amount);
        }
        debit(t, f, amount);
        setAllowance(key, allowance.subtract(amount));
        credit(t, r, amount);
    }

    @Override
    public synchronized void transfer(String token, String to, BigInteger amount) {
        String t = requireAddress(token, "token");
        String r = requireAddress(to, "to");
        requireNonNegative(amount, "amount");
        debit(t, custodyAddress, amount);
        credit(t, r, amount);
    }

    private void debit(String token, String account, BigInteger amount) {
        String key = balanceKey(token, account);
        BigInteger previous = balances.getOrDefault(key, BigInteger.ZERO);
        if (previous.compareTo(amount) < 0) {
            throw new TokenTransferException("余额不足: account=" + account + " balance=" + previous + " amount=" + amount);
        }
        balances.put(key, previous.subtract(amount));
        UndoJournal.record(() -> balances.put(key, previous));
    }

    private void credit(String token, String account, BigInteger amount) {
        String key = balanceKey(token, account);
        BigInteger previous = balances.getOrDefault(key, BigInteger.ZERO);
        balances.put(key, previous.add(amount));
        UndoJournal.record(() -> balances.put(key, previous));
    }

    private void setAllowance(AllowanceKey key, BigInteger amount) {
        BigInteger previous = allowances.getOrDefault(key, BigInteger.ZERO);
        allowances.put(key, amount);
        UndoJournal.record(() -> allowances.put(key, previous));
    }

    private static String balanceKey(String token, String account) {
        return token + "/" + account;
    }
}
