package com.work.bonding.web;

import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.support.InMemoryTokenLedger;
import com.work.bonding.web.dto.MockTokenRequest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * chain.mode=mock 时提供的代币操作入口，方便本地体验完整的建仓/解绑流程。
 */
@RestController
@RequestMapping("/api/v1/mock-token")
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockTokenController {

    private final InMemoryTokenLedger tokenLedger;
    private final BondingConfig config;

    public MockTokenController(InMemoryTokenLedger tokenLedger, BondingConfig config) {
        this.tokenLedger = tokenLedger;
        this.config = config;
    }

    @PostMapping("/mint")
    public ResponseEntity<BigInteger> mint(@Validated @RequestBody MockTokenRequest request) {
        tokenLedger.mint(config.getTokenAddress(), request.getAccount(), request.getAmount());
        return ResponseEntity.ok(tokenLedger.balanceOf(config.getTokenAddress(), request.getAccount()));
    }

    /**
     * 以 account 身份授权账本托管账户拉取 amount。
     */
    @PostMapping("/approve")
    public ResponseEntity<Void> approve(@Validated @RequestBody MockTokenRequest request) {
        tokenLedger.approve(config.getTokenAddress(), request.getAccount(), config.getInstanceAddress(), request.getAmount());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/balances/{account}")
    public ResponseEntity<BigInteger> balanceOf(@PathVariable String account) {
        return ResponseEntity.ok(tokenLedger.balanceOf(config.getTokenAddress(), account));
    }
}
