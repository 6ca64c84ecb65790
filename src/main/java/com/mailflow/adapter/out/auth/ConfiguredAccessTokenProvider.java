package com.mailflow.adapter.out.auth;

import com.mailflow.application.port.out.AccessTokenProvider;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Bearer token from configuration. When a token file is configured it is re-read on every
 * request, so an external process can rotate the token without a restart.
 */
@Component
public class ConfiguredAccessTokenProvider implements AccessTokenProvider {

    private final AppProperties appProperties;

    public ConfiguredAccessTokenProvider(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    public String accessToken() {
        String tokenFile = appProperties.getGmail().getAccessTokenFile();
        if (tokenFile != null && !tokenFile.isBlank()) {
            return readTokenFile(Path.of(tokenFile));
        }
        String token = appProperties.getGmail().getAccessToken();
        if (token == null || token.isBlank()) {
            throw new MailboxAuthorizationException(
                "No access token configured (set app.gmail.access-token or app.gmail.access-token-file)");
        }
        return token.trim();
    }

    private String readTokenFile(Path path) {
        try {
            String token = Files.readString(path, StandardCharsets.UTF_8).trim();
            if (token.isEmpty()) {
                throw new MailboxAuthorizationException("Access token file is empty: " + path);
            }
            return token;
        } catch (IOException e) {
            throw new MailboxAuthorizationException("Cannot read access token file " + path, e);
        }
    }
}
