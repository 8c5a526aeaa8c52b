package com.signalwatch.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Null fields are dropped and instants are written as ISO-8601 strings on every wire payload. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor telemetryObjectMapperCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    configure(om);
                }
                return bean;
            }
        };
    }

    /** Applies the wire conventions to a mapper built outside the Spring context. */
    public static ObjectMapper configure(ObjectMapper om) {
        om.registerModule(new JavaTimeModule());
        om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        om.configure(SerializationFeature.WRITE_NULL_MAP_VALUES, false);
        om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        om.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        return om;
    }
}
