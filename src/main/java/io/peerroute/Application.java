package io.peerroute;

import io.peerroute.config.impl.NodeConfig;
import io.peerroute.config.type.ConfigLoader;
import io.peerroute.node.PeerNode;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;

/**
 * Main class to start a PeerRoute node.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar peerroute.jar <node-config.yaml>");
            System.exit(1);
        }

        final NodeConfig cfg = ConfigLoader.load(args[0]);
        final PeerNode node = PeerNode.create(cfg);
        final CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down PeerRoute node {}...", cfg.getPeerId());
                node.close();
            } finally {
                shutdown.countDown();
            }
        }, "peerroute-shutdown"));

        node.start();
        log.info("PeerRoute node {} running (refresh {}, {} delegate(s))",
                cfg.getPeerId(),
                cfg.getRefresh().enabled() ? "enabled" : "disabled",
                cfg.getDelegates().size());

        shutdown.await();
    }
}
