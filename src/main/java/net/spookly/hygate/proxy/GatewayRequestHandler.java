package net.spookly.hygate.proxy;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import net.spookly.hygate.registry.Route;
import net.spookly.hygate.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-connection handler: resolves the route, applies the route rate limit and hands the request
 * to the executor. This is the outermost boundary, so every failure leaves as the JSON error envelope.
 */
public final class GatewayRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayRequestHandler.class);
    private static final String REQUEST_ID = "x-request-id";
    private static final String RESPONSE_TIME = "x-response-time";

    private final ServiceRegistry registry;
    private final ProxyExecutor executor;
    private final RouteRateLimiter rateLimiter;
    private CompletableFuture<ProxyResponse> inFlight;

    public GatewayRequestHandler(ServiceRegistry registry, ProxyExecutor executor, RouteRateLimiter rateLimiter) {
        this.registry = registry;
        this.executor = executor;
        this.rateLimiter = rateLimiter;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg) {
        long started = System.nanoTime();
        boolean keepAlive = HttpUtil.isKeepAlive(msg);
        String requestId = msg.headers().get(REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String uri = msg.uri();
        int queryStart = uri.indexOf('?');
        String path = queryStart < 0 ? uri : uri.substring(0, queryStart);
        String rawQuery = queryStart < 0 ? null : uri.substring(queryStart + 1);
        String method = msg.method().name();
        try {
            if (!ProxyExecutor.isValidTarget(path, rawQuery)) {
                writeError(ctx, DispatchError.BAD_REQUEST, "Malformed request target", requestId, started, keepAlive);
                return;
            }
            Route route = registry.resolveRoute(path, method);
            if (route == null) {
                writeError(ctx, DispatchError.ROUTE_NOT_FOUND, "No route matches " + method + " " + path,
                        requestId, started, keepAlive);
                return;
            }
            String clientKey = clientKey(ctx.channel().remoteAddress());
            if (!rateLimiter.tryAcquire(route, clientKey)) {
                writeError(ctx, DispatchError.RATE_LIMITED, "Too many requests", requestId, started, keepAlive);
                return;
            }
            ProxyRequest request = new ProxyRequest(method, path, rawQuery,
                    new DefaultHttpHeaders().set(msg.headers()), ByteBufUtil.getBytes(msg.content()),
                    clientKey, requestId);
            CompletableFuture<ProxyResponse> dispatch = executor.forward(request, route);
            inFlight = dispatch;
            String id = requestId;
            dispatch.whenComplete((response, error) -> ctx.executor().execute(() -> {
                if (inFlight == dispatch) {
                    inFlight = null;
                }
                complete(ctx, response, error, id, started, keepAlive);
            }));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure handling {} {}", method, path, e);
            writeError(ctx, DispatchError.INTERNAL_ERROR, "Internal server error", requestId, started, keepAlive);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        CompletableFuture<ProxyResponse> dispatch = inFlight;
        if (dispatch != null && !dispatch.isDone()) {
            dispatch.cancel(false);
        }
        inFlight = null;
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.warn("Gateway connection error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    private void complete(ChannelHandlerContext ctx,
                          ProxyResponse response,
                          Throwable error,
                          String requestId,
                          long started,
                          boolean keepAlive) {
        if (!ctx.channel().isActive()) {
            return;
        }
        if (error == null) {
            FullHttpResponse relayed = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                    HttpResponseStatus.valueOf(response.status()), Unpooled.wrappedBuffer(response.body()));
            relayed.headers().set(response.headers());
            write(ctx, relayed, requestId, started, keepAlive);
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException) {
            return;
        }
        if (cause instanceof DispatchException) {
            DispatchException failure = (DispatchException) cause;
            writeError(ctx, failure.error(), failure.getMessage(), requestId, started, keepAlive);
            return;
        }
        LOG.error("Unexpected dispatch failure for request {}", requestId, cause);
        writeError(ctx, DispatchError.INTERNAL_ERROR, "Internal server error", requestId, started, keepAlive);
    }

    private void writeError(ChannelHandlerContext ctx,
                            DispatchError error,
                            String message,
                            String requestId,
                            long started,
                            boolean keepAlive) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                HttpResponseStatus.valueOf(error.httpStatus()),
                Unpooled.wrappedBuffer(ErrorEnvelope.toJson(error, message)));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        write(ctx, response, requestId, started, keepAlive);
    }

    private void write(ChannelHandlerContext ctx,
                       FullHttpResponse response,
                       String requestId,
                       long started,
                       boolean keepAlive) {
        HttpHeaders headers = response.headers();
        headers.set(REQUEST_ID, requestId);
        headers.set(RESPONSE_TIME, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) + "ms");
        HttpUtil.setContentLength(response, response.content().readableBytes());
        if (keepAlive) {
            headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    static String clientKey(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getAddress() == null ? inet.getHostString() : inet.getAddress().getHostAddress();
        }
        return address == null ? null : address.toString();
    }
}
