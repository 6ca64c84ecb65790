package com.mailflow.adapter.out.gmail;

import com.mailflow.adapter.out.gmail.GmailResources.Header;
import com.mailflow.adapter.out.gmail.GmailResources.Message;
import com.mailflow.adapter.out.gmail.GmailResources.MessagePart;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.Watermarks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

@Component
public class GmailMessageMapper {

    private static final Logger log = LoggerFactory.getLogger(GmailMessageMapper.class);

    static final String NO_SUBJECT = "No Subject";
    static final String UNKNOWN_SENDER = "Unknown Sender";
    private static final String UNREAD_LABEL = "UNREAD";

    MailRecord toRecord(Message message) {
        List<Header> headers = message.payload() != null && message.payload().headers() != null
            ? message.payload().headers()
            : List.of();
        List<String> labels = message.labelIds() != null ? message.labelIds() : List.of();

        return new MailRecord(
            nullToEmpty(message.id()),
            nullToEmpty(message.threadId()),
            parseHistoryId(message.historyId()),
            headerOr(headers, "From", UNKNOWN_SENDER),
            headerOr(headers, "To", ""),
            headerOr(headers, "Subject", NO_SUBJECT),
            nullToEmpty(message.snippet()),
            extractBody(message.payload()),
            labels,
            labels.contains(UNREAD_LABEL),
            resolveDate(message.internalDate(), header(headers, "Date"))
        );
    }

    /**
     * Concatenates the decoded text/plain and text/html parts, walking nested multiparts.
     */
    String extractBody(MessagePart part) {
        if (part == null) {
            return "";
        }
        List<String> texts = new ArrayList<>();
        collectText(part, true, texts);
        return String.join("\n", texts).trim();
    }

    private void collectText(MessagePart part, boolean root, List<String> texts) {
        String mimeType = part.mimeType() == null ? "" : part.mimeType().toLowerCase(Locale.ROOT);
        boolean textPart = mimeType.equals("text/plain") || mimeType.equals("text/html");
        if ((root || textPart) && part.body() != null && part.body().data() != null) {
            String decoded = decode(part.body().data());
            if (!decoded.isEmpty()) {
                texts.add(decoded);
            }
        }
        if (part.parts() != null) {
            for (MessagePart child : part.parts()) {
                String childType = child.mimeType() == null ? "" : child.mimeType().toLowerCase(Locale.ROOT);
                if (childType.startsWith("text/plain") || childType.startsWith("text/html") || childType.startsWith("multipart/")) {
                    collectText(child, false, texts);
                }
            }
        }
    }

    private String decode(String data) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Skipping body part that is not base64url: {}", e.getMessage());
            return "";
        }
    }

    private Instant resolveDate(String internalDate, String dateHeader) {
        if (internalDate != null && !internalDate.isBlank()) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(internalDate.trim()));
            } catch (NumberFormatException e) {
                log.debug("Unparsable internalDate '{}'", internalDate);
            }
        }
        if (dateHeader != null && !dateHeader.isBlank()) {
            try {
                return ZonedDateTime.parse(dateHeader.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparsable Date header '{}'", dateHeader);
            }
        }
        return null;
    }

    private long parseHistoryId(String historyId) {
        if (historyId == null || historyId.isBlank()) {
            return Watermarks.NONE;
        }
        return Watermarks.parse(historyId);
    }

    private static String header(List<Header> headers, String name) {
        return headers.stream()
            .filter(h -> name.equalsIgnoreCase(h.name()))
            .map(Header::value)
            .findFirst()
            .orElse(null);
    }

    private static String headerOr(List<Header> headers, String name, String fallback) {
        String value = header(headers, name);
        return value != null ? value : fallback;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
