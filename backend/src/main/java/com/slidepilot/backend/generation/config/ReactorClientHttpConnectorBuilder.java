package com.slidepilot.backend.generation.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

/**
 * Builds the Reactor Netty connector used for backend calls. The read timeout bounds the gap
 * between two reads, so a stream that keeps producing fragments is never cut off by it.
 */
public class ReactorClientHttpConnectorBuilder {

  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(120);

  public ReactorClientHttpConnectorBuilder connectTimeout(Duration connectTimeout) {
    if (connectTimeout != null && !connectTimeout.isNegative() && !connectTimeout.isZero()) {
      this.connectTimeout = connectTimeout;
    }
    return this;
  }

  public ReactorClientHttpConnectorBuilder readTimeout(Duration readTimeout) {
    if (readTimeout != null && !readTimeout.isNegative() && !readTimeout.isZero()) {
      this.readTimeout = readTimeout;
    }
    return this;
  }

  public ClientHttpConnector build() {
    HttpClient client =
        HttpClient.create()
            .responseTimeout(readTimeout)
            .keepAlive(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    return new ReactorClientHttpConnector(client);
  }
}
