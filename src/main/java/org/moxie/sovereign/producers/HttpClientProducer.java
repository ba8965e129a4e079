package org.moxie.sovereign.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.net.http.HttpClient;
import java.time.Duration;

@ApplicationScoped
public class HttpClientProducer {

  @Produces
  @ApplicationScoped
  public HttpClient getClient() {
    return HttpClient.newBuilder()
                     .connectTimeout(Duration.ofSeconds(10))
                     .build();
  }
}
