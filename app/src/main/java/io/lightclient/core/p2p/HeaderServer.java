package io.lightclient.core.p2p;

import io.lightclient.core.protocol.LightBlock;
import io.lightclient.core.protocol.LightBlockCodec;
import io.lightclient.core.provider.HeaderProvider;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves light blocks from a {@link HeaderProvider} to remote {@link HeaderClient}s.
 * One response per request, matched by request id.
 */
public final class HeaderServer {
    private static final Logger LOG = Logger.getLogger(HeaderServer.class.getName());

    private final int requestedPort;
    private final HeaderProvider provider;
    private final LightBlockCodec codec;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private Channel serverChannel;

    /** @param port 0 binds an ephemeral port, see {@link #port()} */
    public HeaderServer(int port, HeaderProvider provider, LightBlockCodec codec) {
        if (provider == null) throw new IllegalArgumentException("provider required");
        if (codec == null) throw new IllegalArgumentException("codec required");
        this.requestedPort = port;
        this.provider = provider;
        this.codec = codec;
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            HeaderFrames.configure(ch.pipeline(), codec.mapper());
                            ch.pipeline().addLast(new RequestHandler());
                        }
                    });
            serverChannel = bootstrap.bind(requestedPort).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "Header server listening on port " + port());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting header server", e);
        }
    }

    /** Bound port once started. */
    public int port() {
        if (serverChannel == null) return requestedPort;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        LOG.info("Header server stopped");
    }

    HeaderMessage answer(HeaderMessage request) {
        if (!HeaderMessage.GET_LIGHT_BLOCK.equals(request.type())) {
            return HeaderMessage.error(request.requestId(), request.height(), "unsupported message " + request.type());
        }
        try {
            Optional<LightBlock> block = provider.lightBlock(request.height());
            if (block.isEmpty()) {
                return HeaderMessage.notFound(request.requestId(), request.height());
            }
            return HeaderMessage.found(request.requestId(), request.height(), codec.encodeLightBlock(block.get()));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Serving light block " + request.height() + " failed", e);
            return HeaderMessage.error(request.requestId(), request.height(), String.valueOf(e.getMessage()));
        }
    }

    private final class RequestHandler extends SimpleChannelInboundHandler<HeaderMessage> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            channels.add(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, HeaderMessage msg) {
            LOG.fine(() -> "Light block request " + msg.requestId() + " for height " + msg.height());
            ctx.writeAndFlush(answer(msg));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Header server channel error", cause);
            ctx.close();
        }
    }
}
