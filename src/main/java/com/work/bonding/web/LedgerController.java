package com.work.bonding.web;

import com.work.bonding.core.config.BondingConstants;
import com.work.bonding.core.event.LedgerEventRecord;
import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondIntent;
import com.work.bonding.core.model.BondState;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.model.UnbondSettlement;
import com.work.bonding.core.repository.LedgerEventLog;
import com.work.bonding.core.service.BondLedger;
import com.work.bonding.core.service.SlashRegistry;
import com.work.bonding.web.dto.BondIntentRequest;
import com.work.bonding.web.dto.BondOperationView;
import com.work.bonding.web.dto.BondView;
import com.work.bonding.web.dto.LedgerEventView;
import com.work.bonding.web.dto.PoolView;
import com.work.bonding.web.dto.ReplaceBondRequest;
import com.work.bonding.web.dto.SlashRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 账本 REST 接口。调用方身份取自 X-Caller-Address 请求头，鉴权由前置网关完成。
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    static final String CALLER_HEADER = "X-Caller-Address";

    private final SlashRegistry slashRegistry;
    private final BondLedger bondLedger;
    private final LedgerEventLog eventLog;

    public LedgerController(SlashRegistry slashRegistry, BondLedger bondLedger, LedgerEventLog eventLog) {
        this.slashRegistry = slashRegistry;
        this.bondLedger = bondLedger;
        this.eventLog = eventLog;
    }

    @PostMapping("/pools/{poolId}/slash")
    public ResponseEntity<PoolView> slash(@RequestHeader(CALLER_HEADER) String caller,
                                          @PathVariable String poolId,
                                          @Validated @RequestBody SlashRequest request) {
        PoolId pool = PoolId.fromHex(poolId);
        BigInteger newTotal = slashRegistry.slash(caller, pool, request.getPoints());
        return ResponseEntity.ok(toPoolView(pool, newTotal));
    }

    @GetMapping("/pools/{poolId}")
    public ResponseEntity<PoolView> getPool(@PathVariable String poolId) {
        PoolId pool = PoolId.fromHex(poolId);
        return ResponseEntity.ok(toPoolView(pool, slashRegistry.getSlashPoints(pool)));
    }

    @PostMapping("/bonds")
    public ResponseEntity<BondOperationView> addBond(@RequestHeader(CALLER_HEADER) String caller,
                                                     @Validated @RequestBody BondIntentRequest request) {
        BondId bondId = bondLedger.addBond(caller, request.toIntent());
        return ResponseEntity.ok(BondOperationView.ofBond(bondId.toHex()));
    }

    @PostMapping("/bonds/unbond-request")
    public ResponseEntity<BondOperationView> requestUnbond(@RequestHeader(CALLER_HEADER) String caller,
                                                           @Validated @RequestBody BondIntentRequest request) {
        BondIntent intent = request.toIntent();
        long willUnlock = bondLedger.requestUnbond(caller, intent);
        BondOperationView view = BondOperationView.ofBond(bondLedger.bondIdOf(caller, intent).toHex());
        view.setWillUnlock(willUnlock);
        return ResponseEntity.ok(view);
    }

    @PostMapping("/bonds/unbond")
    public ResponseEntity<BondOperationView> unbond(@RequestHeader(CALLER_HEADER) String caller,
                                                    @Validated @RequestBody BondIntentRequest request) {
        UnbondSettlement settlement = bondLedger.unbond(caller, request.toIntent());
        BondOperationView view = BondOperationView.ofBond(settlement.getBondId().toHex());
        view.setPayout(settlement.getPayout());
        view.setBurned(settlement.getBurned());
        return ResponseEntity.ok(view);
    }

    @PostMapping("/bonds/replace")
    public ResponseEntity<BondOperationView> replaceBond(@RequestHeader(CALLER_HEADER) String caller,
                                                         @Validated @RequestBody ReplaceBondRequest request) {
        BondId bondId = bondLedger.replaceBond(caller, request.getOldBond().toIntent(), request.getNewBond().toIntent());
        return ResponseEntity.ok(BondOperationView.ofBond(bondId.toHex()));
    }

    @PostMapping("/bonds/withdraw-amount")
    public ResponseEntity<BondOperationView> withdrawAmount(@RequestHeader(CALLER_HEADER) String caller,
                                                            @Validated @RequestBody BondIntentRequest request) {
        BondIntent intent = request.toIntent();
        BondOperationView view = BondOperationView.ofBond(bondLedger.bondIdOf(caller, intent).toHex());
        view.setWithdrawAmount(bondLedger.getWithdrawAmount(caller, intent));
        return ResponseEntity.ok(view);
    }

    @PostMapping("/bonds/id")
    public ResponseEntity<BondOperationView> bondId(@RequestHeader(CALLER_HEADER) String caller,
                                                    @Validated @RequestBody BondIntentRequest request) {
        return ResponseEntity.ok(BondOperationView.ofBond(bondLedger.bondIdOf(caller, request.toIntent()).toHex()));
    }

    @GetMapping("/bonds/{bondId}")
    public ResponseEntity<BondView> getBond(@PathVariable String bondId) {
        BondId id = BondId.fromHex(bondId);
        Optional<BondState> state = bondLedger.findBond(id);
        if (!state.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        BondView v = new BondView();
        v.setBondId(id.toHex());
        v.setActive(state.get().isActive());
        v.setSlashedAtStart(state.get().getSlashedAtStart());
        v.setWillUnlock(state.get().getWillUnlock());
        return ResponseEntity.ok(v);
    }

    @GetMapping("/events")
    public ResponseEntity<List<LedgerEventView>> listEvents(@RequestParam(value = "afterSeq", required = false) Long afterSeq,
                                                            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        int l = Math.max(1, Math.min(limit, 200));
        List<LedgerEventRecord> records = eventLog.listAfter(afterSeq, l);
        return ResponseEntity.ok(records.stream().map(this::toEventView).collect(Collectors.toList()));
    }

    private PoolView toPoolView(PoolId poolId, BigInteger slashPoints) {
        PoolView v = new PoolView();
        v.setPoolId(poolId.toHex());
        v.setSlashPoints(slashPoints);
        v.setMaxSlash(BondingConstants.MAX_SLASH);
        return v;
    }

    private LedgerEventView toEventView(LedgerEventRecord record) {
        LedgerEventView v = new LedgerEventView();
        v.setSeq(record.getSeq());
        v.setEvent(record.getEvent());
        return v;
    }
}
