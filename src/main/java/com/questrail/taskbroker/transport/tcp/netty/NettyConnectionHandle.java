package com.questrail.taskbroker.transport.tcp.netty;

import com.questrail.taskbroker.transport.ConnectionHandle;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link ConnectionHandle} over a Netty {@link Channel}.
 *
 * <p>{@code Channel.writeAndFlush} is safe from any thread: writes issued off
 * the event loop are queued onto it, which serializes concurrent writers.</p>
 */
final class NettyConnectionHandle implements ConnectionHandle
{
    private final Channel channel;
    private final String id;

    NettyConnectionHandle(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.id = channel.id().asLongText();
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public CompletionStage<Void> send(String line)
    {
        Objects.requireNonNull(line, "line");

        CompletableFuture<Void> result = new CompletableFuture<>();
        if (!channel.isActive()) {
            result.completeExceptionally(new ClosedChannelException());
            return result;
        }

        channel.writeAndFlush(line).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public String toString()
    {
        return "NettyConnectionHandle[" + id + ", remote=" + channel.remoteAddress() + ']';
    }
}
