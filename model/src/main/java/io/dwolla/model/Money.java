package io.dwolla.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

import io.dwolla.util.Assert;

/**
 * An amount of money. The API carries the value as a decimal string.
 */
public record Money(String value, String currency) {

    public static final String USD = "USD";

    public Money {
        Assert.checkNotBlankParam("value", value);
        Assert.checkNotBlankParam("currency", currency);
    }

    public static Money usd(BigDecimal amount) {
        return new Money(amount.setScale(2, RoundingMode.UNNECESSARY).toPlainString(), USD);
    }

    public static Money usd(String amount) {
        return usd(new BigDecimal(amount));
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(value);
    }
}
