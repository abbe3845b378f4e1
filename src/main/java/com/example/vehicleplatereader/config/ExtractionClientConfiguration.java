package com.example.vehicleplatereader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used for the text extraction service. Timeouts bound only this call.
 */
@Configuration
public class ExtractionClientConfiguration {

    @Bean
    public RestClient extractionRestClient(RestClient.Builder builder, PlateReaderProperties properties) {
        PlateReaderProperties.OpenAi openai = properties.openai();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(openai.connectTimeout());
        requestFactory.setReadTimeout(openai.timeout());
        return builder
                .baseUrl(stripTrailingSlash(openai.baseUrl()))
                .requestFactory(requestFactory)
                .build();
    }

    static String stripTrailingSlash(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
