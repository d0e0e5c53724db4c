package com.questrail.taskbroker.transport.tcp.netty;

import com.questrail.taskbroker.transport.ConnectionHandle;
import com.questrail.taskbroker.transport.LineEndpoint;
import com.questrail.taskbroker.transport.LineEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * NettyLineEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It accepts TCP
 * connections, frames inbound bytes into UTF-8 lines and writes outbound
 * strings. It MUST NOT:
 * <ul>
 *   <li>Decode broker messages</li>
 *   <li>Hold registry, ledger or session state</li>
 *   <li>Close connections on protocol grounds</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Connections leave it as {@link ConnectionHandle}s.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   LineBasedFrameDecoder(maxLineLength) → StringDecoder(UTF-8) → ConnectionHandler
 *   StringEncoder(UTF-8) on the outbound side
 * </pre>
 * Over-long lines are discarded and reported through
 * {@link LineEndpointListener#onFramingError}; the connection stays open.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds synchronously. {@link #stop()} closes every accepted
 * channel, the server channel, and shuts down both event loop groups. An
 * endpoint is single-use.
 */
public final class NettyLineEndpoint implements LineEndpoint
{
    private final String name;
    private final InetSocketAddress bindAddress;
    private final int maxLineLength;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup acceptedChannels;
    private final ServerBootstrap bootstrap;

    private volatile LineEndpointListener listener;
    private volatile Channel serverChannel;

    /**
     * @param name          endpoint name, used for thread names
     * @param bindAddress   address to listen on; port 0 picks an ephemeral port
     * @param maxLineLength longest accepted line in bytes, terminator excluded
     */
    public NettyLineEndpoint(String name, InetSocketAddress bindAddress, int maxLineLength)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be > 0");
        }
        this.maxLineLength = maxLineLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.acceptedChannels = new DefaultChannelGroup(name + "-connections", GlobalEventExecutor.INSTANCE);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("frameDecoder", new LineBasedFrameDecoder(NettyLineEndpoint.this.maxLineLength));
                        p.addLast("stringDecoder", new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast("stringEncoder", new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast("connection", new ConnectionHandler());
                    }
                });
    }

    @Override
    public void setListener(LineEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        LineEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            l.onTransportDown(f.cause());
            shutdownGroups();
            throw new IllegalStateException(
                    "Failed to bind " + name + " endpoint on " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        l.onTransportUp(serverChannel.localAddress());
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        // Closing accepted channels drives channelInactive, so every session
        // sees its close before the groups go away.
        acceptedChannels.close().awaitUninterruptibly();
        shutdownGroups();

        LineEndpointListener l = listener;
        if (l != null && ch != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            return Optional.empty();
        }
        return Optional.of((InetSocketAddress) ch.localAddress());
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private LineEndpointListener requireListener()
    {
        LineEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One instance per accepted channel. Runs on that channel's event loop,
     * which gives the per-connection callback ordering the listener contract
     * promises.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<String>
    {
        private NettyConnectionHandle handle;
        private Throwable closeCause;
        private boolean closed;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            acceptedChannels.add(ctx.channel());
            handle = new NettyConnectionHandle(ctx.channel());

            LineEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(handle);
            }
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            LineEndpointListener l = listener;
            if (l != null && handle != null && !closed) {
                l.onLine(handle, line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (!closed && handle != null) {
                closed = true;
                LineEndpointListener l = listener;
                if (l != null) {
                    l.onConnectionClosed(handle, closeCause);
                }
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException && handle != null) {
                LineEndpointListener l = listener;
                if (l != null) {
                    l.onFramingError(handle, cause);
                }
                return;
            }

            closeCause = cause;
            ctx.close();
        }
    }
}
