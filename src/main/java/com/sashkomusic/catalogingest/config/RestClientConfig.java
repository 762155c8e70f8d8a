package com.sashkomusic.catalogingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(CatalogConfig catalogConfig) {
        return RestClient.builder()
                .requestFactory(requestFactory(catalogConfig.getHttp()));
    }

    static JdkClientHttpRequestFactory requestFactory(CatalogConfig.Http http) {
        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(http.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(http.getReadTimeout());
        return requestFactory;
    }
}
