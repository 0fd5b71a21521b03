package com.sidexkit.engine.executor.config;

import com.sidexkit.engine.crypto.NonceSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * One JDK {@link HttpClient} shared by all venues, one {@link RestClient} per venue endpoint.
 */
@Configuration
public class VenueHttpConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public NonceSource nonceSource(Clock clock) {
    return new NonceSource(clock);
  }

  @Bean
  public HttpClient httpClient(ExecutorProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.http().connectTimeout())
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }

  @Bean
  public RestClient bybitRestClient(HttpClient httpClient, ExecutorProperties properties) {
    return restClient(httpClient, properties, properties.bybit().baseUrl());
  }

  @Bean
  public RestClient hyperliquidRestClient(HttpClient httpClient, ExecutorProperties properties) {
    return restClient(httpClient, properties, properties.hyperliquid().baseUrl());
  }

  @Bean
  public RestClient jupiterRestClient(HttpClient httpClient, ExecutorProperties properties) {
    return restClient(httpClient, properties, properties.jupiter().quoteApiUrl());
  }

  @Bean
  public RestClient solanaRpcRestClient(HttpClient httpClient, ExecutorProperties properties) {
    return restClient(httpClient, properties, properties.jupiter().rpcUrl());
  }

  private static RestClient restClient(HttpClient httpClient, ExecutorProperties properties, String baseUrl) {
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.http().readTimeout());
    return RestClient.builder()
        .requestFactory(requestFactory)
        .baseUrl(baseUrl)
        .build();
  }
}
