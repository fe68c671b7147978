package quest.gekko.smm.config;

import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class WebClientConfig {

    @Bean
    public WebClient webClient(final WebClient.Builder builder, final MonitorProperties properties) {
        final Duration timeout = properties.getHttp().getTimeout();
        final HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs()
                        .maxInMemorySize((int) properties.getHttp().getMaxInMemorySize().toBytes()))
                .build();
    }
}
