package net.spookly.proxygroup.backend;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpVersion;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Routed backend reached through a plain HTTP forward proxy.
 */
@Getter
@Accessors(fluent = true)
public final class HttpProxyBackend implements Backend {
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String USER_AGENT = "proxygroup-probe";

    private final String name;
    private final String host;
    private final int port;
    @Getter(AccessLevel.NONE)
    private final EventLoopGroup workerGroup;

    public HttpProxyBackend(String name, String host, int port, EventLoopGroup workerGroup) {
        this.name = Objects.requireNonNull(name, "name");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    }

    @Override
    public BackendKind kind() {
        return BackendKind.ROUTED;
    }

    /**
     * Send {@code HEAD <url>} through the proxy and complete with the time until the response head arrives.
     */
    @Override
    public CompletableFuture<Duration> probe(ProbeContext context, String url) {
        Objects.requireNonNull(context, "context");
        URI target;
        try {
            target = probeTarget(url);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Duration> result = new CompletableFuture<>();
        long startNanos = System.nanoTime();
        Duration connectTimeout = context.remaining(DEFAULT_CONNECT_TIMEOUT);
        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1L, Math.min(Integer.MAX_VALUE, connectTimeout.toMillis())))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        channel.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new ProbeResponseHandler(result, startNanos));
                    }
                });

        ChannelFuture connectFuture = bootstrap.connect(host, port);
        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
                return;
            }
            future.channel().writeAndFlush(headRequest(target)).addListener((ChannelFutureListener) write -> {
                if (!write.isSuccess()) {
                    result.completeExceptionally(write.cause());
                }
            });
        });
        Runnable detach = context.whenDone(result::completeExceptionally);
        result.whenComplete((latency, error) -> {
            detach.run();
            if (!connectFuture.isDone()) {
                connectFuture.cancel(false);
            }
            connectFuture.channel().close();
        });
        return result;
    }

    private static URI probeTarget(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Probe url is required");
        }
        URI uri = URI.create(url.trim());
        if (!"http".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
            throw new IllegalArgumentException("Probe url must be an absolute http url: " + url);
        }
        return uri;
    }

    private static FullHttpRequest headRequest(URI target) {
        String path = target.getRawPath() == null || target.getRawPath().isEmpty() ? "/" : target.getRawPath();
        String query = target.getRawQuery() == null ? "" : "?" + target.getRawQuery();
        String hostHeader = target.getPort() > 0 ? target.getHost() + ":" + target.getPort() : target.getHost();
        String absolute = "http://" + hostHeader + path + query;
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.HEAD, absolute);
        request.headers()
                .set(HttpHeaderNames.HOST, hostHeader)
                .set(HttpHeaderNames.USER_AGENT, USER_AGENT)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
                .set(HttpHeaderNames.CONTENT_LENGTH, 0);
        return request;
    }

    private static final class ProbeResponseHandler extends SimpleChannelInboundHandler<HttpObject> {
        private final CompletableFuture<Duration> result;
        private final long startNanos;

        private ProbeResponseHandler(CompletableFuture<Duration> result, long startNanos) {
            this.result = result;
            this.startNanos = startNanos;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg) {
            if (msg instanceof HttpResponse) {
                result.complete(Duration.ofNanos(System.nanoTime() - startNanos));
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.completeExceptionally(new IOException("Proxy closed the connection before responding"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }
    }
}
