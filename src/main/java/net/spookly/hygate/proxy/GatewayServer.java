package net.spookly.hygate.proxy;

import java.net.InetSocketAddress;
import java.util.Objects;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import net.spookly.hygate.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP listener accepting client requests and dispatching them through the executor.
 */
public final class GatewayServer {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);

    private final String host;
    private final int port;
    private final int maxContentBytes;
    private final ServiceRegistry registry;
    private final ProxyExecutor executor;
    private final RouteRateLimiter rateLimiter;
    private final EventLoopGroup workerGroup;
    private EventLoopGroup bossGroup;
    private Channel channel;

    /**
     * @param workerGroup event loops for client connections; owned by the caller
     */
    public GatewayServer(String host,
                         int port,
                         int maxContentBytes,
                         ServiceRegistry registry,
                         ProxyExecutor executor,
                         RouteRateLimiter rateLimiter,
                         EventLoopGroup workerGroup) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.maxContentBytes = maxContentBytes;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    }

    /**
     * Bind the listener. Port 0 binds an ephemeral port, see {@link #boundPort()}.
     */
    public void start() {
        if (channel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpServerExpectContinueHandler());
                        ch.pipeline().addLast(new HttpObjectAggregator(maxContentBytes));
                        ch.pipeline().addLast(new GatewayRequestHandler(registry, executor, rateLimiter));
                    }
                });
        InetSocketAddress address = new InetSocketAddress(host, port);
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Gateway bind interrupted", e);
        }
        LOG.info("Gateway listening on {}:{}", address.getHostString(), boundPort());
    }

    public int boundPort() {
        if (channel == null) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    public void stop() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}
