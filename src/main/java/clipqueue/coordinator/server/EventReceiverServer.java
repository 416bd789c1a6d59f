package clipqueue.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for backend event ingress and the job API.
 */
public final class EventReceiverServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventReceiverServer.class);

    private final RouterHandler router;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public EventReceiverServer(RouterHandler router) {
        this.router = router;
    }

    public synchronized void start(String host, int port) {
        if (serverChannel != null)
            return;
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(1024 * 1024));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            log.info("Event receiver listening on {}:{}", host, port);
        } catch (RuntimeException e) {
            log.error("Failed to start event receiver on {}:{}", host, port, e);
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
            log.info("Event receiver stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
