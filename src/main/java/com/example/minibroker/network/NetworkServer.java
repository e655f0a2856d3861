package com.example.minibroker.network;

import com.example.minibroker.config.BrokerConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * Accepts client connections and gives each one its own framing pipeline.
 * The boss group only accepts, connections are served on the worker group so a slow
 * client never holds up the others.
 */
@Slf4j
public class NetworkServer {
    private final BrokerConfig config;
    private final ConnectionListener listener;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ChannelFuture serverChannel;

    public NetworkServer(BrokerConfig config, ConnectionListener listener) {
        this.config = config;
        this.listener = listener;
    }

    /**
     * Bind the listening socket and start accepting connections.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) {
                     ChannelPipeline p = ch.pipeline();
                     p.addLast(
                         new RequestHeaderDecoder(), // Inbound
                         new ResponseHeaderEncoder(), // Outbound
                         new ConnectionHandler(listener) // per connection state
                     );
                 }
             })
             .option(ChannelOption.SO_BACKLOG, 128)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childOption(ChannelOption.SO_KEEPALIVE, true);

            serverChannel = b.bind(new InetSocketAddress(config.getHost(), config.getPort())).sync();
            log.info("Network server listening on {}:{}", config.getHost(), getBoundPort());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new IllegalStateException("Interrupted while binding " + config.getHost() + ":" + config.getPort(), e);
        } catch (Exception e) {
            shutdown();
            throw new IllegalStateException("Failed to bind " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    /**
     * Port the server is actually listening on, useful when configured with port 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("Network server is not started");
        }
        return ((InetSocketAddress) serverChannel.channel().localAddress()).getPort();
    }

    public void shutdown() {
        log.info("Shutting down network server...");

        if (serverChannel != null) {
            serverChannel.channel().close().awaitUninterruptibly();
            serverChannel = null;
        }

        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }

        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        log.info("Network server stopped");
    }
}
