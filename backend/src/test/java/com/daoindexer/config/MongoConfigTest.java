package com.daoindexer.config;

import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MongoConfigTest {

    private final MongoConfig.AmountWritingConverter writer = new MongoConfig.AmountWritingConverter();
    private final MongoConfig.AmountReadingConverter reader = new MongoConfig.AmountReadingConverter();

    @Test
    void nanoPrecisionIsKept() {
        BigDecimal price = new BigDecimal("12.000000001");

        assertThat(reader.convert(writer.convert(price))).isEqualByComparingTo(price);
    }

    @Test
    void valuesWiderThanDecimal128AreRounded() {
        BigDecimal wide = new BigDecimal("1.00000000000000000000000000000000005");

        Decimal128 stored = writer.convert(wide);

        assertThat(stored.bigDecimalValue()).isEqualByComparingTo(BigDecimal.ONE);
    }
}
