package com.sni.curation.config;

import com.sni.curation.model.ClusterGroupStatus;
import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Accepts the lower-case wire names of the curation enums in query parameters and path variables.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new CurationStatusParamConverter());
        registry.addConverter(new CurationSourceParamConverter());
        registry.addConverter(new ClusterGroupStatusParamConverter());
    }

    static class CurationStatusParamConverter implements Converter<String, CurationStatus> {
        @Override
        public CurationStatus convert(String source) {
            return CurationStatus.fromValue(source.trim());
        }
    }

    static class CurationSourceParamConverter implements Converter<String, CurationSource> {
        @Override
        public CurationSource convert(String source) {
            return CurationSource.fromValue(source.trim());
        }
    }

    static class ClusterGroupStatusParamConverter implements Converter<String, ClusterGroupStatus> {
        @Override
        public ClusterGroupStatus convert(String source) {
            return ClusterGroupStatus.fromValue(source.trim());
        }
    }
}
