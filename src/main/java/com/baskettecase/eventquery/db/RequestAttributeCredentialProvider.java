package com.baskettecase.eventquery.db;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.util.Optional;

/**
 * Reads the request-scoped connection string from a request attribute.
 *
 * The hosting layer stores the connection string under
 * {@code eventquery.request.credential-attribute} before the request reaches application
 * code. Outside a request, or when the attribute is absent or blank, nothing is returned.
 */
@Component
public class RequestAttributeCredentialProvider implements RequestCredentialProvider {

    private final String attributeName;

    public RequestAttributeCredentialProvider(
            @Value("${eventquery.request.credential-attribute:databaseUrl}") String attributeName) {
        this.attributeName = attributeName;
    }

    @Override
    public Optional<String> currentConnectionString() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return Optional.empty();
        }

        Object value = attributes.getAttribute(attributeName, RequestAttributes.SCOPE_REQUEST);
        return value instanceof String ? normalize((String) value) : Optional.empty();
    }

    static Optional<String> normalize(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
