package com.daoindexer.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Order prices, bids and activity amounts are stored as Decimal128. Indexes come from
 * {@code @CompoundIndex} / {@code @Indexed} on the documents.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(new AmountWritingConverter(), new AmountReadingConverter()));
    }

    /** Values wider than 34 significant digits are rounded half-even; Decimal128 rejects them otherwise. */
    @WritingConverter
    static class AmountWritingConverter implements Converter<BigDecimal, Decimal128> {

        @Override
        public Decimal128 convert(BigDecimal source) {
            BigDecimal value = source.precision() > MathContext.DECIMAL128.getPrecision()
                    ? source.round(MathContext.DECIMAL128)
                    : source;
            return new Decimal128(value);
        }
    }

    @ReadingConverter
    static class AmountReadingConverter implements Converter<Decimal128, BigDecimal> {

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
