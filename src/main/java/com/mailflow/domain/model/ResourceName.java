package com.mailflow.domain.model;

import com.mailflow.domain.error.ValidationError.ResourceNameError;

/**
 * A fully qualified messaging resource name such as {@code projects/p/topics/t}
 * or {@code projects/p/subscriptions/s}.
 */
public record ResourceName(Kind kind, String project, String id) {

    public enum Kind {
        TOPIC("topics"),
        SUBSCRIPTION("subscriptions");

        private final String collection;

        Kind(String collection) {
            this.collection = collection;
        }

        public String collection() {
            return collection;
        }

        String label() {
            return this == TOPIC ? "topic" : "subscription";
        }
    }

    public static Result<ResourceName, ResourceNameError> parseTopic(String value) {
        return parse(Kind.TOPIC, value);
    }

    public static Result<ResourceName, ResourceNameError> parseSubscription(String value) {
        return parse(Kind.SUBSCRIPTION, value);
    }

    public static Result<ResourceName, ResourceNameError> parse(Kind kind, String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new ResourceNameError.Empty(kind.label()));
        }
        String[] parts = value.trim().split("/");
        if (parts.length != 4
                || !"projects".equals(parts[0])
                || !kind.collection().equals(parts[2])
                || parts[1].isBlank()
                || parts[3].isBlank()) {
            return Result.failure(new ResourceNameError.InvalidFormat(
                kind.label(), value, "projects/{project}/" + kind.collection() + "/{id}"));
        }
        return Result.success(new ResourceName(kind, parts[1], parts[3]));
    }

    public String path() {
        return "projects/" + project + "/" + kind.collection() + "/" + id;
    }

    @Override
    public String toString() {
        return path();
    }
}
