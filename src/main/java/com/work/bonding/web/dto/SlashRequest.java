package com.work.bonding.web.dto;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public class SlashRequest {

    /** 追加的 slash points，10^18 = 100%。 */
    @NotNull(message = "points 不能为空")
    @PositiveOrZero(message = "points 不能为负数")
    private BigInteger points;

    public BigInteger getPoints() {
        return points;
    }

    public void setPoints(BigInteger points) {
        this.points = points;
    }
}
