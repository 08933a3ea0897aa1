package com.baskettecase.eventquery.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestAttributeCredentialProvider
 */
class RequestAttributeCredentialProviderTest {

    private final RequestAttributeCredentialProvider provider = new RequestAttributeCredentialProvider("databaseUrl");

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void testNoRequestContext() {
        assertEquals(Optional.empty(), provider.currentConnectionString());
    }

    @Test
    void testReadsRequestAttribute() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute("databaseUrl", " postgresql://tenant:pw@db/events ");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals(Optional.of("postgresql://tenant:pw@db/events"), provider.currentConnectionString());
    }

    @Test
    void testMissingOrBlankAttribute() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals(Optional.empty(), provider.currentConnectionString());

        request.setAttribute("databaseUrl", "");
        assertEquals(Optional.empty(), provider.currentConnectionString());

        request.setAttribute("databaseUrl", 42);
        assertEquals(Optional.empty(), provider.currentConnectionString());
    }
}
