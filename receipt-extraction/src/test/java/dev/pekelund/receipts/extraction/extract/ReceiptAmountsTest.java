package dev.pekelund.receipts.extraction.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ReceiptAmountsTest {

    @ParameterizedTest
    @CsvSource({
        "3.50, 3.50",
        "'$1,234.56', 1234.56",
        "'12,50', 12.50",
        "-1.00, -1.00",
        "2.00-, -2.00",
        "€ 4.99, 4.99"
    })
    void parsesPrintedAmounts(String token, String expected) {
        assertThat(ReceiptAmounts.parse(token)).hasValueSatisfying(
            value -> assertThat(value).isEqualByComparingTo(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "-"})
    void ignoresTokensWithoutDigits(String token) {
        assertThat(ReceiptAmounts.parse(token)).isEmpty();
    }

    @Test
    void picksRightMostAmountOnLine() {
        assertThat(ReceiptAmounts.lastAmount("Apples 3 @ 0.50 1.50")).contains(new BigDecimal("1.50"));
        assertThat(ReceiptAmounts.lastAmount("TOTAL")).isEmpty();
    }

    @Test
    void distinguishesAmountsFromOtherNumbers() {
        assertThat(ReceiptAmounts.containsAmount("Tel 555-1234")).isFalse();
        assertThat(ReceiptAmounts.containsAmount("Bread 2.00")).isTrue();
        assertThat(ReceiptAmounts.isAmountOnly("  9.72 ")).isTrue();
        assertThat(ReceiptAmounts.isAmountOnly("TOTAL 9.72")).isFalse();
    }
}
