package org.tramway.server;

import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.tramway.app.Application;
import org.tramway.http.routing.DispatcherHandler;
import org.tramway.server.dto.ServerProperties;

/**
 * HTTP/1.1 server that feeds aggregated requests into an {@link Application}.
 * Application code runs on a dedicated executor group, never on the I/O event loop.
 */
public class TramwayHttp extends AbstractNettyServer {

    private final DispatcherHandler dispatcherHandler;
    private final EventExecutorGroup handlerGroup;
    private final int maxContentLength;

    public TramwayHttp(Application application, ServerProperties properties) {
        super(properties.getHost(), properties.getPort(), properties.getBossThreads(), properties.getWorkerThreads());
        this.dispatcherHandler = new DispatcherHandler(application);
        this.handlerGroup = new DefaultEventExecutorGroup(properties.getHandlerThreads());
        this.maxContentLength = properties.getMaxContentLength();
    }

    @Override
    protected void initChannel(SocketChannel socketChannel) {
        ChannelPipeline pipeline = socketChannel.pipeline();
        pipeline.addLast("codec", new HttpServerCodec());
        pipeline.addLast("aggregator", new HttpObjectAggregator(maxContentLength));
        pipeline.addLast(handlerGroup, "handler", dispatcherHandler);
    }

    @Override
    protected void onShutdown() {
        handlerGroup.shutdownGracefully();
    }

}
