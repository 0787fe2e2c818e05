package net.spookly.hygate.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class RouteTest {
    @Test
    void wildcardMatchesNestedSegments() {
        Route route = Route.of("/api/users/*", "users");

        assertTrue(route.matches("/api/users/42", "GET"));
        assertTrue(route.matches("/api/users/42/orders", "DELETE"));
        assertFalse(route.matches("/api/users", "GET"));
        assertFalse(route.matches("/api/userss", "GET"));
    }

    @Test
    void patternIsAnchoredAndLiteral() {
        Route route = Route.of("/v1.0/items", "items");

        assertTrue(route.matches("/v1.0/items", "GET"));
        assertFalse(route.matches("/v1x0/items", "GET"));
        assertFalse(route.matches("/prefix/v1.0/items", "GET"));
    }

    @Test
    void methodsAreCaseInsensitive() {
        Route route = Route.of("/api/orders", "orders", "get", "Post");

        assertEquals(List.of("GET", "POST"), route.methods());
        assertTrue(route.matches("/api/orders", "post"));
        assertFalse(route.matches("/api/orders", "DELETE"));
    }

    @Test
    void exactPatternOutranksWildcardWithSamePrefix() {
        Route exact = Route.of("/api/users", "users");
        Route wildcard = Route.of("/api/users*", "users");

        assertTrue(exact.specificity() > wildcard.specificity());
    }

    @Test
    void stripPrefixRemovesLiteralPart() {
        Route route = new Route("/api/v1/users/*", "users", null, false, true, null, null, null);

        assertEquals("/42", route.targetPath("/api/v1/users/42"));
        assertEquals("/42/orders", route.targetPath("/api/v1/users/42/orders"));
        assertEquals("/", route.stripPrefix("/api/v1/users/"));
        assertEquals("/api/v1/users/42", Route.of("/api/v1/users/*", "users").targetPath("/api/v1/users/42"));
    }

    @Test
    void rejectsRelativePattern() {
        assertThrows(IllegalArgumentException.class, () -> Route.of("api/users", "users"));
    }
}
