package io.lightclient.core.p2p;

import io.lightclient.core.protocol.LightBlock;
import io.lightclient.core.protocol.LightBlockCodec;
import io.lightclient.core.provider.HeaderProvider;
import io.lightclient.core.provider.ProviderException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link HeaderProvider} backed by a remote {@link HeaderServer}. Each fetch waits at most
 * the configured timeout; timeouts, transport errors and server errors surface as
 * {@link ProviderException}.
 */
public final class HeaderClient implements HeaderProvider, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(HeaderClient.class.getName());

    private final String host;
    private final int port;
    private final long timeoutMillis;
    private final LightBlockCodec codec;

    private final NioEventLoopGroup group = new NioEventLoopGroup(1);
    private final Map<Long, CompletableFuture<HeaderMessage>> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextRequestId = new AtomicLong(1);

    private Channel channel;

    public HeaderClient(String host, int port, long timeoutMillis, LightBlockCodec codec) {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host required");
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeout must be > 0");
        if (codec == null) throw new IllegalArgumentException("codec required");
        this.host = host;
        this.port = port;
        this.timeoutMillis = timeoutMillis;
        this.codec = codec;
    }

    /** Parses {@code host:port}. */
    public static HeaderClient connectTo(String endpoint, long timeoutMillis, LightBlockCodec codec) {
        if (endpoint == null) throw new IllegalArgumentException("endpoint required");
        int colon = endpoint.lastIndexOf(':');
        if (colon <= 0 || colon == endpoint.length() - 1) {
            throw new IllegalArgumentException("Invalid provider endpoint: " + endpoint);
        }
        int port;
        try {
            port = Integer.parseInt(endpoint.substring(colon + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid provider port in endpoint: " + endpoint, e);
        }
        return new HeaderClient(endpoint.substring(0, colon).trim(), port, timeoutMillis, codec);
    }

    @Override
    public Optional<LightBlock> lightBlock(long height) {
        long requestId = nextRequestId.getAndIncrement();
        CompletableFuture<HeaderMessage> response = new CompletableFuture<>();
        pending.put(requestId, response);
        try {
            channel().writeAndFlush(HeaderMessage.request(requestId, height));
            HeaderMessage msg = response.get(timeoutMillis, TimeUnit.MILLISECONDS);
            switch (msg.type()) {
                case HeaderMessage.LIGHT_BLOCK:
                    if (msg.lightBlock() == null || msg.lightBlock().isNull()) {
                        throw new ProviderException("empty light block response for height " + height);
                    }
                    return Optional.of(codec.decodeLightBlock(msg.lightBlock()));
                case HeaderMessage.NOT_FOUND:
                    return Optional.empty();
                default:
                    throw new ProviderException("provider error at height " + height + ": " + msg.error());
            }
        } catch (TimeoutException e) {
            throw new ProviderException("no light block for height " + height + " within " + timeoutMillis + "ms", e);
        } catch (ExecutionException e) {
            throw new ProviderException("fetching height " + height + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("interrupted fetching height " + height, e);
        } catch (IllegalArgumentException e) {
            throw new ProviderException("malformed light block for height " + height, e);
        } finally {
            pending.remove(requestId);
        }
    }

    private synchronized Channel channel() throws InterruptedException {
        if (channel != null && channel.isActive()) {
            return channel;
        }
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        HeaderFrames.configure(ch.pipeline(), codec.mapper());
                        ch.pipeline().addLast(new ResponseHandler());
                    }
                });
        ChannelFuture connect = bootstrap.connect(host, port).await();
        if (!connect.isSuccess()) {
            throw new ProviderException("cannot connect to header provider " + host + ':' + port, connect.cause());
        }
        channel = connect.channel();
        LOG.info(() -> "Connected to header provider " + host + ':' + port);
        return channel;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (channel != null) {
                channel.close().awaitUninterruptibly();
                channel = null;
            }
        }
        pending.values().forEach(f -> f.completeExceptionally(new ProviderException("client closed")));
        pending.clear();
        group.shutdownGracefully();
    }

    private final class ResponseHandler extends SimpleChannelInboundHandler<HeaderMessage> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, HeaderMessage msg) {
            CompletableFuture<HeaderMessage> waiting = pending.get(msg.requestId());
            if (waiting == null) {
                LOG.fine(() -> "Dropping late response " + msg.requestId());
                return;
            }
            waiting.complete(msg);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            pending.values().forEach(f -> f.completeExceptionally(new ProviderException("connection closed")));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Header client channel error", cause);
            ctx.close();
        }
    }
}
