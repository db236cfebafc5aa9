package io.peerroute.routing.delegate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringEncoder;
import io.peerroute.config.impl.DelegateConfig;
import io.peerroute.core.codec.Base58;
import io.peerroute.core.cursor.BufferedPeerCursor;
import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.model.NetworkAddress;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.QueryOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Peer router backed by a remote delegate node's DHT HTTP API
 * ({@code /api/v0/dht/findpeer}, {@code /api/v0/dht/query}).
 * <p>
 * Each call opens its own HTTP/1.1 connection and streams the ndjson response. Cancelling the
 * {@code findPeer} future or closing the cursor closes the connection.
 */
@Slf4j
public final class DelegatedPeerRouter implements PeerRouter {

    static final String FIND_PEER_PATH = "/api/v0/dht/findpeer";
    static final String QUERY_PATH = "/api/v0/dht/query";

    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final DelegateConfig config;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DelegatedPeerRouter(final DelegateConfig config) {
        this.config = config;

        final IoHandlerFactory factory = NioIoHandler.newFactory();
        this.group = new MultiThreadIoEventLoopGroup(1, factory);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS);

        log.info("DelegatedPeerRouter using {}", config.baseUrl());
    }

    @Override
    public CompletableFuture<Optional<PeerRecord>> findPeer(final PeerId id, final QueryOptions options) {
        if (closed.get()) return CompletableFuture.failedFuture(new IllegalStateException("DelegatedPeerRouter is closed"));

        final CompletableFuture<Optional<PeerRecord>> result = new CompletableFuture<>();
        final QueryEventListener listener = new QueryEventListener() {
            @Override
            public boolean onEvent(final QueryEvent event) throws Exception {
                switch (event.eventType()) {
                    case FINAL_PEER -> {
                        final List<PeerRecord> found = finalPeers(event, Map.of());
                        if (found.isEmpty()) return true;
                        result.complete(Optional.of(found.get(0)));
                        return false;
                    }
                    case QUERY_ERROR -> throw new DelegateResponseException(-1, errorText(event));
                    default -> {
                        return true;
                    }
                }
            }

            @Override
            public void onEnd() {
                result.complete(Optional.empty());
            }

            @Override
            public void onError(final Throwable cause) {
                result.completeExceptionally(cause);
            }

            @Override
            public boolean demanding() {
                return !result.isDone();
            }
        };

        final Channel channel = open(uri(FIND_PEER_PATH, id.toBase58(), options), listener);
        result.whenComplete((r, err) -> channel.close());
        return result;
    }

    @Override
    public PeerCursor getClosestPeers(final byte[] key, final QueryOptions options) {
        final String uri = uri(QUERY_PATH, Base58.encode(key), options);
        final AtomicReference<Channel> channel = new AtomicReference<>();

        final Map<String, List<String>> addressesByPeer = new LinkedHashMap<>();
        final AtomicReference<BufferedPeerCursor> self = new AtomicReference<>();

        final QueryEventListener listener = new QueryEventListener() {
            @Override
            public boolean onEvent(final QueryEvent event) throws Exception {
                final BufferedPeerCursor cursor = self.get();
                switch (event.eventType()) {
                    case PEER_RESPONSE -> {
                        if (event.getResponses() != null) {
                            for (final QueryEvent.PeerInfo peer : event.getResponses()) {
                                if (peer.getId() == null) continue;
                                final List<String> known = addressesByPeer.computeIfAbsent(peer.getId(), k -> new ArrayList<>());
                                if (peer.getAddrs() != null) known.addAll(peer.getAddrs());
                            }
                        }
                        return true;
                    }
                    case FINAL_PEER -> {
                        for (final PeerRecord record : finalPeers(event, addressesByPeer)) {
                            if (!cursor.offer(record)) return false;
                        }
                        return true;
                    }
                    case QUERY_ERROR -> throw new DelegateResponseException(-1, errorText(event));
                    default -> {
                        return true;
                    }
                }
            }

            @Override
            public void onEnd() {
                self.get().end();
            }

            @Override
            public void onError(final Throwable cause) {
                self.get().fail(cause);
            }

            @Override
            public boolean demanding() {
                return self.get().isDemanding();
            }
        };

        final BufferedPeerCursor cursor = new BufferedPeerCursor(
                () -> {
                    final Channel ch = channel.get();
                    if (ch == null) {
                        if (closed.get()) {
                            self.get().fail(new IllegalStateException("DelegatedPeerRouter is closed"));
                            return;
                        }
                        final Channel opened = open(uri, listener);
                        if (!channel.compareAndSet(null, opened)) opened.close();
                    } else {
                        ch.read();
                    }
                },
                () -> {
                    final Channel ch = channel.get();
                    if (ch != null) ch.close();
                });
        self.set(cursor);
        return cursor;
    }

    /**
     * Connects, sends the request and starts reading. The returned channel may not be connected yet;
     * closing it aborts the call either way.
     */
    private Channel open(final String uri, final QueryEventListener listener) {
        final ChannelFuture connect = bootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new NdjsonResponseHandler(mapper, listener));
                    }
                })
                .connect(config.host(), config.port());

        connect.addListener((ChannelFuture cf) -> {
            if (!cf.isSuccess()) {
                listener.onError(new DelegateResponseException(
                        "Cannot reach delegate " + config.baseUrl() + ": " + cf.cause().getMessage(), cf.cause()));
                return;
            }

            final FullHttpRequest request = new DefaultFullHttpRequest(
                    HttpVersion.HTTP_1_1, HttpMethod.POST, uri, Unpooled.EMPTY_BUFFER);
            request.headers()
                    .set(HttpHeaderNames.HOST, config.host() + ":" + config.port())
                    .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
                    .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
                    .set(HttpHeaderNames.CONTENT_LENGTH, 0);

            cf.channel().writeAndFlush(request).addListener(wf -> {
                if (!wf.isSuccess()) {
                    log.error("Request to delegate {} failed: {}", config.baseUrl(), wf.cause().getMessage());
                    listener.onError(new DelegateResponseException(
                            "Cannot send request to " + config.baseUrl(), wf.cause()));
                    cf.channel().close();
                } else {
                    cf.channel().read();
                }
            });
        });

        return connect.channel();
    }

    private static String uri(final String path, final String arg, final QueryOptions options) {
        final QueryStringEncoder encoder = new QueryStringEncoder(path);
        encoder.addParam("arg", arg);
        options.timeoutIfSet()
                .map(Duration::toMillis)
                .ifPresent(ms -> encoder.addParam("timeout", ms + "ms"));
        return encoder.toString();
    }

    /*
     * A final-peer event names its peers either in Responses (findpeer) or in its own ID (query).
     * Addresses seen in earlier peer-response events are merged in front of the event's own.
     */
    private static List<PeerRecord> finalPeers(final QueryEvent event, final Map<String, List<String>> known) {
        final List<PeerRecord> out = new ArrayList<>();
        if (event.getResponses() != null && !event.getResponses().isEmpty()) {
            for (final QueryEvent.PeerInfo peer : event.getResponses()) {
                if (peer.getId() == null || peer.getId().isEmpty()) continue;
                out.add(record(peer.getId(), known.get(peer.getId()), peer.getAddrs()));
            }
        } else if (event.getId() != null && !event.getId().isEmpty()) {
            out.add(record(event.getId(), known.get(event.getId()), null));
        }
        return out;
    }

    private static PeerRecord record(final String id, final List<String> gathered, final List<String> own) {
        final List<NetworkAddress> addresses = new ArrayList<>();
        if (gathered != null) gathered.forEach(a -> addresses.add(NetworkAddress.parse(a)));
        if (own != null) own.forEach(a -> addresses.add(NetworkAddress.parse(a)));
        return new PeerRecord(PeerId.fromBase58(id), addresses);
    }

    private static String errorText(final QueryEvent event) {
        return event.getExtra() == null || event.getExtra().isEmpty() ? "delegate query error" : event.getExtra();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        log.info("DelegatedPeerRouter {} closed.", config.baseUrl());
    }

    @Override
    public String toString() {
        return "DelegatedPeerRouter{" + config.baseUrl() + "}";
    }
}
