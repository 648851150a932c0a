package taskescrow.registry.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the registry API.
 */
public final class RegistryNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RegistryNettyServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public RegistryNettyServer(RouterHandler router) {
        this.router = router;
    }

    private ChannelHandler pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind and start serving. Port 0 picks a free port, see {@link #port()}.
     */
    public synchronized void start(String host, int port) {
        if (running) {
            log.warn("Server already running on port {}", port());
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Task registry server started on {}:{}", host, port());
        } catch (RuntimeException e) {
            log.error("Failed to start server on {}:{}", host, port, e);
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                running = false;
                log.info("Task registry server stopped");
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Actual bound port, or -1 when not running */
    public int port() {
        Channel ch = serverChannel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    @Override
    public void close() {
        stop();
    }
}
