package personal.labs.core.identity.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Identity Service RestClient Configuration
 *
 * Timeout 전략:
 * - Connect Timeout (200ms): TCP 연결 실패 빠른 감지
 * - Read Timeout (1000ms): Circuit Breaker Slow Call 기준과 일치
 */
@Configuration
public class IdentityRestClientConfig {

    @Value("${external.identity-service.base-url}")
    private String identityServiceBaseUrl;

    @Value("${external.identity-service.connect-timeout-ms:200}")
    private int connectTimeoutMs;

    @Value("${external.identity-service.read-timeout-ms:1000}")
    private int readTimeoutMs;

    @Bean
    public RestClient identityServiceRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(identityServiceBaseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
