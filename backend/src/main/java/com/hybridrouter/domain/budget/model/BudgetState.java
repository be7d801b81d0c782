package com.hybridrouter.domain.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Immutable spend snapshot for the current month and day. Replaced wholesale on every change.
 */
public record BudgetState(
        YearMonth month,
        LocalDate day,
        BigDecimal monthSpend,
        BigDecimal daySpend
) {
    public static BudgetState start(LocalDate today) {
        return new BudgetState(YearMonth.from(today), today, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /**
     * Applies period rollover: a new month resets everything, a new day resets the day spend.
     * A date earlier than the current day leaves the state unchanged.
     */
    public BudgetState rollTo(LocalDate today) {
        if (!YearMonth.from(today).equals(month)) {
            return today.isAfter(day) ? start(today) : this;
        }
        if (today.isAfter(day)) {
            return new BudgetState(month, today, monthSpend, BigDecimal.ZERO);
        }
        return this;
    }

    public BudgetState plus(BigDecimal amount) {
        return new BudgetState(month, day, monthSpend.add(amount), daySpend.add(amount));
    }

    public BigDecimal spendBeforeToday() {
        return monthSpend.subtract(daySpend);
    }
}
