package com.chanakya.vault.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

@Configuration
public class MongoConfig {

    /**
     * Metric names extracted from lab reports ("Vit. D", "HbA1c (%)") end up as map keys,
     * and Mongo rejects dots in keys written through the mapping layer.
     */
    private static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    @Bean
    public MappingMongoConverter mappingMongoConverter(MongoMappingContext mappingContext,
                                                       MongoCustomConversions conversions) {
        MappingMongoConverter converter = new MappingMongoConverter(NoOpDbRefResolver.INSTANCE, mappingContext);
        converter.setCustomConversions(conversions);
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}
