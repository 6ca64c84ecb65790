package com.mailflow.adapter.out.auth;

import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredAccessTokenProviderTest {

    @TempDir
    Path directory;

    private AppProperties appProperties;
    private ConfiguredAccessTokenProvider provider;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        provider = new ConfiguredAccessTokenProvider(appProperties);
    }

    @Test
    void shouldReturnConfiguredToken() {
        appProperties.getGmail().setAccessToken("  ya29.token  ");

        assertEquals("ya29.token", provider.accessToken());
    }

    @Test
    void shouldRejectMissingToken() {
        assertThrows(MailboxAuthorizationException.class, provider::accessToken);
    }

    @Test
    void shouldPreferTokenFileAndRereadIt() throws Exception {
        Path tokenFile = directory.resolve("token");
        Files.writeString(tokenFile, "first\n");
        appProperties.getGmail().setAccessToken("inline");
        appProperties.getGmail().setAccessTokenFile(tokenFile.toString());

        assertEquals("first", provider.accessToken());

        Files.writeString(tokenFile, "rotated");
        assertEquals("rotated", provider.accessToken());
    }

    @Test
    void shouldRejectEmptyOrMissingTokenFile() throws Exception {
        Path tokenFile = directory.resolve("token");
        appProperties.getGmail().setAccessTokenFile(tokenFile.toString());

        assertThrows(MailboxAuthorizationException.class, provider::accessToken);

        Files.writeString(tokenFile, "   ");
        assertThrows(MailboxAuthorizationException.class, provider::accessToken);
    }
}
