package com.work.bonding.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;

public class ReplaceBondRequest {

    @Valid
    @NotNull(message = "oldBond 不能为空")
    private BondIntentRequest oldBond;

    @Valid
    @NotNull(message = "newBond 不能为空")
    private BondIntentRequest newBond;

    public BondIntentRequest getOldBond() {
        return oldBond;
    }

    public void setOldBond(BondIntentRequest oldBond) {
        this.oldBond = oldBond;
    }

    public BondIntentRequest getNewBond() {
        return newBond;
    }

    public void setNewBond(BondIntentRequest newBond) {
        this.newBond = newBond;
    }
}
