package com.example.minibroker.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers every decoded request header with a response header carrying the same correlation ID.
 * One instance per connection: the state below is only touched from that channel's event loop.
 * Any read or write failure is fatal for the connection, it is reported and the channel closed.
 */
@Slf4j
public class ConnectionHandler extends SimpleChannelInboundHandler<RequestHeader> {
    private final ConnectionListener listener;
    private ConnectionState state = ConnectionState.AWAITING_REQUEST;

    public ConnectionHandler(ConnectionListener listener) {
        this.listener = listener;
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        listener.connectionOpened(ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RequestHeader request) {
        if (state == ConnectionState.CLOSED) {
            log.debug("Dropping request with correlation ID {} on closed connection", request.getCorrelationId());
            return;
        }

        state = ConnectionState.PROCESSING;
        listener.requestReceived(ctx.channel().remoteAddress(), request);

        ResponseHeader response = ResponseHeader.forRequest(request);
        ctx.writeAndFlush(response).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                listener.responseSent(ctx.channel().remoteAddress(), response);
                if (state == ConnectionState.PROCESSING) {
                    state = ConnectionState.AWAITING_REQUEST;
                }
            } else {
                listener.writeFailed(ctx.channel().remoteAddress(),
                        new WriteFailureException(response.getCorrelationId(), future.cause()));
                abandon(ctx);
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // everything reaching here comes from the inbound side of the pipeline
        ReadFailureException failure = cause instanceof ReadFailureException
                ? (ReadFailureException) cause
                : new ReadFailureException(cause);
        listener.readFailed(ctx.channel().remoteAddress(), failure);
        abandon(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state = ConnectionState.CLOSED;
        listener.connectionClosed(ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    private void abandon(ChannelHandlerContext ctx) {
        state = ConnectionState.CLOSED;
        ctx.close();
    }
}
