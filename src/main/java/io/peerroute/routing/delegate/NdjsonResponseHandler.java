package io.peerroute.routing.delegate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpStatusClass;
import io.netty.handler.codec.http.LastHttpContent;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Splits a streamed HTTP response body into newline-delimited JSON events.
 * <p>
 * The channel runs with auto-read off: after each read batch another read is requested only while
 * the listener is still demanding, so a slow consumer holds the delegate back through TCP.
 * A non-2xx status fails the listener with the (truncated) body as message.
 */
@Slf4j
final class NdjsonResponseHandler extends SimpleChannelInboundHandler<HttpObject> {

    private static final int MAX_ERROR_BODY = 512;

    private final ObjectMapper mapper;
    private final QueryEventListener listener;

    private ByteBuf lines;
    private HttpResponseStatus errorStatus;
    private final StringBuilder errorBody = new StringBuilder();
    private boolean done;

    NdjsonResponseHandler(final ObjectMapper mapper, final QueryEventListener listener) {
        this.mapper = mapper;
        this.listener = listener;
    }

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) {
        lines = ctx.alloc().buffer();
    }

    @Override
    public void handlerRemoved(final ChannelHandlerContext ctx) {
        if (lines != null) {
            lines.release();
            lines = null;
        }
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final HttpObject msg) {
        if (done) return;

        if (msg instanceof HttpResponse response) {
            if (response.status().codeClass() != HttpStatusClass.SUCCESS) {
                errorStatus = response.status();
            }
        }

        if (msg instanceof HttpContent content) {
            if (errorStatus != null) {
                appendErrorBody(content.content());
            } else {
                lines.writeBytes(content.content());
                drain(ctx, false);
            }

            if (!done && msg instanceof LastHttpContent) {
                if (errorStatus != null) {
                    finish(ctx, new DelegateResponseException(errorStatus.code(),
                            "Delegate responded " + errorStatus + errorBodySuffix()));
                    return;
                }
                drain(ctx, true);
                if (!done) {
                    done = true;
                    listener.onEnd();
                    ctx.close();
                }
            }
        }
    }

    @Override
    public void channelReadComplete(final ChannelHandlerContext ctx) {
        if (!done && listener.demanding()) {
            ctx.read();
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (!done) {
            done = true;
            listener.onError(new DelegateResponseException(-1, "Delegate connection closed before the response ended"));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        finish(ctx, new DelegateResponseException("Delegate request failed: " + cause.getMessage(), cause));
    }

    /* Decodes every complete line; at end of body the unterminated remainder counts as a line too. */
    private void drain(final ChannelHandlerContext ctx, final boolean endOfBody) {
        while (!done && lines.isReadable()) {
            final int eol = lines.indexOf(lines.readerIndex(), lines.writerIndex(), (byte) '\n');
            if (eol < 0 && !endOfBody) break;

            final int length = (eol < 0 ? lines.writerIndex() : eol) - lines.readerIndex();
            final String line = lines.readCharSequence(length, StandardCharsets.UTF_8).toString().trim();
            if (eol >= 0) lines.skipBytes(1);

            if (line.isEmpty()) continue;

            final QueryEvent event;
            try {
                event = mapper.readValue(line, QueryEvent.class);
            } catch (final JsonProcessingException e) {
                finish(ctx, new DelegateResponseException("Malformed delegate event: " + abbreviate(line), e));
                return;
            }

            try {
                if (!listener.onEvent(event)) {
                    done = true;
                    ctx.close();
                    return;
                }
            } catch (final Exception e) {
                finish(ctx, e instanceof DelegateResponseException
                        ? e
                        : new DelegateResponseException("Invalid delegate event: " + e.getMessage(), e));
                return;
            }
        }
        lines.discardReadBytes();
    }

    private void finish(final ChannelHandlerContext ctx, final Throwable cause) {
        if (done) return;
        done = true;
        log.debug("Delegate response failed: {}", cause.getMessage());
        listener.onError(cause);
        ctx.close();
    }

    private void appendErrorBody(final ByteBuf content) {
        final int room = MAX_ERROR_BODY - errorBody.length();
        if (room <= 0) return;
        final int n = Math.min(room, content.readableBytes());
        errorBody.append(content.toString(content.readerIndex(), n, StandardCharsets.UTF_8));
    }

    private String errorBodySuffix() {
        final String body = errorBody.toString().trim();
        return body.isEmpty() ? "" : ": " + body;
    }

    private static String abbreviate(final String line) {
        return line.length() <= 120 ? line : line.substring(0, 120) + "...";
    }
}
