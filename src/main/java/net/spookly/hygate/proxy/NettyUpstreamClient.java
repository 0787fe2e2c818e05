package net.spookly.hygate.proxy;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;

/**
 * HTTP/1.1 client on Netty. Each exchange uses its own connection, closed once the response is read.
 */
public final class NettyUpstreamClient implements UpstreamClient {
    private final EventLoopGroup workerGroup;
    private final boolean ownsGroup;
    private final int connectTimeoutMs;
    private final int maxContentBytes;

    /**
     * Create a client with a dedicated event loop group.
     */
    public NettyUpstreamClient(int connectTimeoutMs, int maxContentBytes) {
        this(new NioEventLoopGroup(), true, connectTimeoutMs, maxContentBytes);
    }

    /**
     * Create a client on a shared event loop group.
     */
    public NettyUpstreamClient(EventLoopGroup workerGroup, int connectTimeoutMs, int maxContentBytes) {
        this(workerGroup, false, connectTimeoutMs, maxContentBytes);
    }

    private NettyUpstreamClient(EventLoopGroup workerGroup, boolean ownsGroup, int connectTimeoutMs, int maxContentBytes) {
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.ownsGroup = ownsGroup;
        this.connectTimeoutMs = connectTimeoutMs;
        this.maxContentBytes = maxContentBytes;
    }

    public EventLoopGroup workerGroup() {
        return workerGroup;
    }

    @Override
    public CompletableFuture<UpstreamResponse> execute(UpstreamRequest request) {
        Objects.requireNonNull(request, "request");
        CompletableFuture<UpstreamResponse> result = new CompletableFuture<>();
        URI uri = request.uri();
        int port = uri.getPort() == -1 ? 80 : uri.getPort();
        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpClientCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(maxContentBytes));
                        ch.pipeline().addLast(new ResponseHandler(result));
                    }
                });
        ChannelFuture connectFuture = bootstrap.connect(uri.getHost(), port);
        Channel channel = connectFuture.channel();
        // Any completion, cancellation included, releases the connection.
        result.whenComplete((response, error) -> {
            if (!connectFuture.isDone()) {
                connectFuture.cancel(false);
            }
            channel.close();
        });
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
                return;
            }
            if (result.isDone()) {
                return;
            }
            channel.writeAndFlush(toNettyRequest(request, uri, port)).addListener(write -> {
                if (!write.isSuccess()) {
                    result.completeExceptionally(write.cause());
                }
            });
        });
        return result;
    }

    @Override
    public void close() {
        if (ownsGroup) {
            workerGroup.shutdownGracefully();
        }
    }

    private static FullHttpRequest toNettyRequest(UpstreamRequest request, URI uri, int port) {
        String target = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            target = target + "?" + uri.getRawQuery();
        }
        byte[] body = request.body() == null ? new byte[0] : request.body();
        FullHttpRequest nettyRequest = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1,
                HttpMethod.valueOf(request.method()), target, Unpooled.wrappedBuffer(body));
        HttpHeaders headers = nettyRequest.headers();
        if (request.headers() != null) {
            headers.set(request.headers());
        }
        if (!headers.contains(HttpHeaderNames.HOST)) {
            headers.set(HttpHeaderNames.HOST, port == 80 ? uri.getHost() : uri.getHost() + ":" + port);
        }
        headers.set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return nettyRequest;
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<UpstreamResponse> result;

        private ResponseHandler(CompletableFuture<UpstreamResponse> result) {
            this.result = result;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            HttpHeaders headers = new DefaultHttpHeaders().set(msg.headers());
            result.complete(new UpstreamResponse(msg.status().code(), headers, ByteBufUtil.getBytes(msg.content())));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.completeExceptionally(new IOException("Upstream closed the connection before responding"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }
    }
}
