package examples;

import io.satnet.SatNet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Runs a single store-and-forward node until the process is terminated.
 * Usage: {@code SatNetRouter [configDir]}
 */
@Slf4j
public class SatNetRouter {

    public static void main(String[] args) throws IOException, InterruptedException {
        var configDir = args.length > 0 ? args[0] : null;
        var satNet = new SatNet(configDir).start();
        log.info("Node {} running at {}, config in {}",
                satNet.getNode().getNodeId(), satNet.getNode().getEndpoint(), satNet.getConfigPath());

        new CountDownLatch(1).await();
    }
}
