package io.b2mash.orghierarchy.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ImportClientConfig.ImportProperties.class)
public class ImportClientConfig {

  /**
   * @param url endpoint imported by the startup run
   * @param preset named import configuration, {@code paatos} unless set
   * @param renameDataSource {@code old:new} data source renames
   * @param runOnStartup whether to import {@code url} when the application starts
   */
  @ConfigurationProperties("orghierarchy.import")
  public record ImportProperties(
      String url,
      String preset,
      List<String> renameDataSource,
      boolean runOnStartup,
      Duration connectTimeout,
      Duration readTimeout) {

    public ImportProperties {
      preset = preset != null && !preset.isBlank() ? preset : "paatos";
      renameDataSource = renameDataSource != null ? List.copyOf(renameDataSource) : List.of();
      connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
      readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(30);
    }
  }

  @Bean
  RestClient importRestClient(RestClient.Builder builder, ImportProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
