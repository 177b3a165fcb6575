package com.example.mailmerge.config;

import com.example.mailmerge.security.ConsentFlow;
import com.example.mailmerge.security.ConsoleConsentFlow;
import com.example.mailmerge.security.LoopbackConsentFlow;
import com.example.mailmerge.service.GoogleAuthService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

@Configuration
public class MailMergeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** {@code loopback} for machines with a browser, {@code console} for headless ones. */
    @Bean
    public ConsentFlow consentFlow(GoogleAuthService googleAuthService,
                                   @Value("${mailmerge.oauth.consent-mode:loopback}") String consentMode) {
        switch (consentMode.trim().toLowerCase(Locale.ROOT)) {
            case "loopback":
                return new LoopbackConsentFlow(googleAuthService);
            case "console":
                return new ConsoleConsentFlow(googleAuthService);
            default:
                throw new IllegalArgumentException("Unknown mailmerge.oauth.consent-mode '" + consentMode
                        + "', expected loopback or console");
        }
    }
}
