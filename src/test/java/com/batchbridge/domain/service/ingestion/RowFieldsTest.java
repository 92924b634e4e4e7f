package com.batchbridge.domain.service.ingestion;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowFieldsTest {

    @Test
    void decimal_acceptsValuesThatFitAnAmountColumn() throws InvalidRecordException {
        assertEquals(0, new BigDecimal("100.25").compareTo(fields("100.25").decimal("amount")));
        assertEquals(0, new BigDecimal("999999999999999.9999")
                .compareTo(fields("999999999999999.9999").decimal("amount")));
        assertEquals(0, new BigDecimal("12.5").compareTo(fields("12.500000").decimal("amount")));
        assertEquals(0, new BigDecimal("1500").compareTo(fields("1.5E+3").decimal("amount")));
    }

    @Test
    void decimal_rejectsExtremeExponents() {
        InvalidRecordException huge = assertThrows(InvalidRecordException.class,
                () -> fields("1E+2147483647").decimal("amount"));
        assertTrue(huge.getMessage().contains("out of range"));

        InvalidRecordException tiny = assertThrows(InvalidRecordException.class,
                () -> fields("1E-2147483647").decimal("amount"));
        assertTrue(tiny.getMessage().contains("decimal places"));
    }

    @Test
    void decimal_rejectsTooManyIntegerOrFractionDigits() {
        assertThrows(InvalidRecordException.class, () -> fields("1000000000000000").decimal("amount"));
        assertThrows(InvalidRecordException.class, () -> fields("0.00001").decimal("amount"));
        assertThrows(InvalidRecordException.class, () -> fields("12,50").decimal("amount"));
    }

    private static RowFields fields(String amount) {
        return new RowFields(Map.of("amount", amount));
    }
}
