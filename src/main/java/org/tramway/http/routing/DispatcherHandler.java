package org.tramway.http.routing;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import lombok.extern.slf4j.Slf4j;
import org.tramway.app.Application;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.common.HttpMethod;

import java.util.Optional;

/**
 * Bridges Netty and the application: converts the aggregated request, runs it through the
 * application and writes the response back. Stateless, so one instance serves all channels.
 */
@Slf4j
@ChannelHandler.Sharable
public class DispatcherHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final Application application;

    public DispatcherHandler(Application application) {
        this.application = application;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest httpRequest) {
        boolean keepAlive = HttpUtil.isKeepAlive(httpRequest);

        if (!httpRequest.decoderResult().isSuccess()) {
            write(ctx, new Response().badRequest("Bad Request"), false);
            return;
        }

        Optional<HttpMethod> method = HttpMethod.resolve(httpRequest.method().name());
        if (method.isEmpty()) {
            Response notImplemented = new Response().status(HttpResponseStatus.NOT_IMPLEMENTED).send("Not Implemented");
            write(ctx, notImplemented, keepAlive);
            return;
        }

        Request request = new Request(
                method.get(),
                httpRequest.uri(),
                httpRequest.headers().copy(),
                ByteBufUtil.getBytes(httpRequest.content()),
                ctx.channel().remoteAddress()
        );

        ChannelFutureListener cancelOnClose = future -> request.cancel();
        ctx.channel().closeFuture().addListener(cancelOnClose);
        Response response;
        try {
            response = application.handle(request);
        } finally {
            ctx.channel().closeFuture().removeListener(cancelOnClose);
        }

        if (!ctx.channel().isActive()) {
            log.debug("Client went away before the response to {} {} was ready", request.getMethod(), request.getPath());
            return;
        }
        write(ctx, response, keepAlive);
    }

    private void write(ChannelHandlerContext ctx, Response response, boolean keepAlive) {
        FullHttpResponse httpResponse = response.toNettyResponse();
        HttpUtil.setKeepAlive(httpResponse, keepAlive);
        ChannelFuture future = ctx.writeAndFlush(httpResponse);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unexpected error on channel {}", ctx.channel().id(), cause);
        ctx.close();
    }

}
