package net.spookly.hygate.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Maps an inbound path pattern and method set to a target service.
 * <p>
 * Patterns are anchored globs where {@code *} matches any character sequence, including {@code /}.
 */
@Getter
@Accessors(fluent = true)
public final class Route {
    public static final String ANY_METHOD = "*";

    private final String pathPattern;
    private final String targetService;
    private final List<String> methods;
    private final boolean requiresAuth;
    private final boolean stripPathPrefix;
    private final RateLimit rateLimit;
    private final Integer timeoutMs;
    private final Integer retries;
    @Getter(AccessLevel.NONE)
    private final Pattern compiled;
    @Getter(AccessLevel.NONE)
    private final String literalPrefix;

    public Route(String pathPattern,
                 String targetService,
                 List<String> methods,
                 boolean requiresAuth,
                 boolean stripPathPrefix,
                 RateLimit rateLimit,
                 Integer timeoutMs,
                 Integer retries) {
        if (pathPattern == null || !pathPattern.startsWith("/")) {
            throw new IllegalArgumentException("route path must start with /: " + pathPattern);
        }
        if (targetService == null || targetService.isBlank()) {
            throw new IllegalArgumentException("route target service is required: " + pathPattern);
        }
        this.pathPattern = pathPattern;
        this.targetService = targetService;
        this.methods = normalizeMethods(methods);
        this.requiresAuth = requiresAuth;
        this.stripPathPrefix = stripPathPrefix;
        this.rateLimit = rateLimit;
        this.timeoutMs = timeoutMs;
        this.retries = retries;
        this.compiled = compile(pathPattern);
        int wildcard = pathPattern.indexOf('*');
        this.literalPrefix = wildcard < 0 ? pathPattern : pathPattern.substring(0, wildcard);
    }

    public static Route of(String pathPattern, String targetService, String... methods) {
        List<String> list = methods.length == 0 ? null : List.of(methods);
        return new Route(pathPattern, targetService, list, false, false, null, null, null);
    }

    public boolean matches(String path, String method) {
        if (path == null || !compiled.matcher(path).matches()) {
            return false;
        }
        return acceptsMethod(method);
    }

    public boolean acceptsMethod(String method) {
        if (methods.contains(ANY_METHOD)) {
            return true;
        }
        return method != null && methods.contains(method.toUpperCase(Locale.ROOT));
    }

    public boolean isExact() {
        return pathPattern.indexOf('*') < 0;
    }

    /**
     * Ranking used when several routes match: longer literal prefixes win, and an exact pattern
     * outranks a wildcard pattern with the same prefix length.
     */
    public int specificity() {
        return literalPrefix.length() * 2 + (isExact() ? 1 : 0);
    }

    /**
     * Path forwarded to the backend once the literal part of the pattern is removed.
     */
    public String stripPrefix(String path) {
        String prefix = pathPattern.endsWith("/*")
                ? pathPattern.substring(0, pathPattern.length() - 2)
                : literalPrefix;
        if (prefix.isEmpty() || !path.startsWith(prefix)) {
            return path;
        }
        String remainder = path.substring(prefix.length());
        if (remainder.isEmpty()) {
            return "/";
        }
        return remainder.startsWith("/") ? remainder : "/" + remainder;
    }

    /**
     * Path forwarded to the backend for an inbound path, honoring {@link #stripPathPrefix()}.
     */
    public String targetPath(String path) {
        return stripPathPrefix ? stripPrefix(path) : path;
    }

    @Override
    public String toString() {
        return String.join(",", methods) + " " + pathPattern + " -> " + targetService;
    }

    private static List<String> normalizeMethods(List<String> methods) {
        if (methods == null || methods.isEmpty()) {
            return List.of(ANY_METHOD);
        }
        List<String> normalized = new ArrayList<>(methods.size());
        for (String method : methods) {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("route methods must not be blank");
            }
            normalized.add(method.trim().toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableList(normalized);
    }

    private static Pattern compile(String pathPattern) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int wildcard;
        while ((wildcard = pathPattern.indexOf('*', start)) >= 0) {
            if (wildcard > start) {
                regex.append(Pattern.quote(pathPattern.substring(start, wildcard)));
            }
            regex.append(".*");
            start = wildcard + 1;
        }
        if (start < pathPattern.length()) {
            regex.append(Pattern.quote(pathPattern.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }
}
