package net.spookly.hygate.registry;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One reachable copy of a service. Only the registry health check mutates its status.
 */
@Getter
@Accessors(fluent = true)
public final class ServiceInstance {
    private final String id;
    private final String serviceName;
    private final URI url;
    private final int weight;
    private volatile InstanceStatus status = InstanceStatus.UNKNOWN;
    private volatile Instant lastCheckedAt;
    private volatile long lastCheckMs;

    public ServiceInstance(String id, String serviceName, String url, int weight) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("instance id is required");
        }
        if (weight < 1) {
            throw new IllegalArgumentException("instance weight must be at least 1: " + id);
        }
        this.id = id;
        this.serviceName = serviceName;
        this.url = parseUrl(id, url);
        this.weight = weight;
    }

    public ServiceInstance(String id, String serviceName, String url) {
        this(id, serviceName, url, 1);
    }

    public String host() {
        return url.getHost();
    }

    public int port() {
        return url.getPort() == -1 ? 80 : url.getPort();
    }

    /**
     * Base path of the instance URL without a trailing slash; empty when the URL has no path.
     */
    public String basePath() {
        String path = url.getRawPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return "";
        }
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    /**
     * Build the absolute URI for a path (and optional raw query) on this instance.
     */
    public URI resolve(String path, String rawQuery) {
        StringBuilder target = new StringBuilder()
                .append("http://").append(host()).append(':').append(port())
                .append(basePath())
                .append(path == null || path.isEmpty() ? "/" : path);
        if (rawQuery != null && !rawQuery.isEmpty()) {
            target.append('?').append(rawQuery);
        }
        return URI.create(target.toString());
    }

    void markChecked(InstanceStatus status, Instant checkedAt, long responseTimeMs) {
        this.status = status;
        this.lastCheckedAt = checkedAt;
        this.lastCheckMs = responseTimeMs;
    }

    @Override
    public String toString() {
        return id + "(" + url + ")";
    }

    private static URI parseUrl(String id, String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("instance url is required: " + id);
        }
        try {
            URI uri = new URI(url.trim());
            if (!"http".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
                throw new IllegalArgumentException("instance url must be http://host[:port]: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("instance url is invalid: " + url, e);
        }
    }
}
