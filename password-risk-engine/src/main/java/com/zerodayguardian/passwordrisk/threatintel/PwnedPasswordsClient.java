package com.zerodayguardian.passwordrisk.threatintel;

import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Have I Been Pwned "Pwned Passwords" range API client.
 *
 * <p>
 * No API key is required. When padding is enabled the service adds decoy
 * suffixes with a count of 0 so response size does not reveal the prefix's
 * real population.
 * </p>
 *
 * @see <a href="https://haveibeenpwned.com/API/v3#PwnedPasswords">Pwned Passwords API</a>
 * @author Naveed Gung
 */
@Component
public class PwnedPasswordsClient implements PwnedRangeClient {

    private static final Logger log = LoggerFactory.getLogger(PwnedPasswordsClient.class);

    private final WebClient webClient;

    @Autowired
    public PwnedPasswordsClient(PasswordAnalyzerConfig analyzerConfig) {
        this(buildWebClient(analyzerConfig.getOnline()));
    }

    public PwnedPasswordsClient(WebClient webClient) {
        this.webClient = webClient;
    }

    static WebClient buildWebClient(PasswordAnalyzerConfig.Online config) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.TEXT_PLAIN_VALUE);
        if (config.isAddPadding()) {
            builder.defaultHeader("Add-Padding", "true");
        }
        return builder.build();
    }

    @Override
    public Mono<String> fetchRange(String prefix) {
        log.debug("Requesting breach range for prefix {}", prefix);
        return webClient.get()
                .uri("/range/{prefix}", prefix)
                .retrieve()
                .bodyToMono(String.class);
    }
}
