package com.kincircle.trust.config;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound client for the audit log and the assistant proxy.
 */
@Configuration
public class HttpConfig {

    @Bean
    public RestTemplate restTemplate(TrustProperties props) {
        TrustProperties.Http http = props.getHttp();
        PoolingHttpClientConnectionManager cm = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultSocketConfig(SocketConfig.custom()
                        .setSoTimeout(Timeout.ofMilliseconds(http.getReadTimeoutMs()))
                        .build())
                .build();
        CloseableHttpClient client = HttpClients.custom().setConnectionManager(cm).build();

        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(client);
        f.setConnectTimeout(http.getConnectTimeoutMs());
        return new RestTemplate(f);
    }
}
