package org.tramway.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public abstract class AbstractNettyServer {

    protected final String host;
    protected final int port;
    private final int bossThreads;
    private final int workerThreads;
    private volatile Channel serverChannel;

    protected AbstractNettyServer(String host, int port, int bossThreads, int workerThreads) {
        this.host = host;
        this.port = port;
        this.bossThreads = bossThreads;
        this.workerThreads = workerThreads;
    }

    public void start() throws InterruptedException {
        EventLoopGroup bossGroup = new NioEventLoopGroup(bossThreads);
        EventLoopGroup workerGroup = new NioEventLoopGroup(workerThreads);
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel socketChannel) {
                            AbstractNettyServer.this.initChannel(socketChannel);
                        }
                    });

            ChannelFuture future = bootstrap.bind(host, port).sync();
            serverChannel = future.channel();
            log.info("{} listening on {}:{}", getClass().getSimpleName(), host, port);
            serverChannel.closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            onShutdown();
            log.info("{} on port {} stopped", getClass().getSimpleName(), port);
        }
    }

    public void stop() {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.close();
        }
    }

    protected abstract void initChannel(SocketChannel socketChannel);

    protected void onShutdown() {
    }

}
