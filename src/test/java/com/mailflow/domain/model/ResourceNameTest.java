package com.mailflow.domain.model;

import com.mailflow.domain.error.ValidationError.ResourceNameError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceName")
class ResourceNameTest {

    @Test
    @DisplayName("Should parse a topic name")
    void shouldParseTopic() {
        var result = ResourceName.parseTopic("projects/acme/topics/mail-events");

        assertTrue(result.isSuccess());
        ResourceName name = result.getOrThrow();
        assertEquals("acme", name.project());
        assertEquals("mail-events", name.id());
        assertEquals("projects/acme/topics/mail-events", name.path());
    }

    @Test
    @DisplayName("Should reject an empty name")
    void shouldRejectEmpty() {
        var result = ResourceName.parseSubscription("  ");

        assertTrue(result.isFailure());
        assertInstanceOf(ResourceNameError.Empty.class, result.errorOrNull());
        assertEquals("SUBSCRIPTION_NAME_EMPTY", result.errorOrNull().code());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "mail-events",
        "projects/acme/subscriptions/mail-events",
        "projects//topics/mail-events",
        "projects/acme/topics/",
        "projects/acme/topics/a/b"
    })
    @DisplayName("Should reject malformed topic names")
    void shouldRejectMalformedTopic(String value) {
        var result = ResourceName.parseTopic(value);

        assertTrue(result.isFailure());
        assertInstanceOf(ResourceNameError.InvalidFormat.class, result.errorOrNull());
    }
}
