package org.prisma.node.processes.broker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-based hand-over of the broker URL from the coordinating rank to the other ranks.
 * <p>
 * The coordinator writes {@code tcp://host:port} atomically to
 * {@code {directory}/broker-{jobKey}.url}; other ranks poll for the file until it appears or
 * the timeout expires. The directory must be visible to all nodes.
 */
public class BrokerRendezvous {

    private static final Logger log = LoggerFactory.getLogger(BrokerRendezvous.class);

    private final Path file;
    private final Duration timeout;
    private final Duration pollInterval;

    /**
     * @param directory    shared directory.
     * @param jobKey       identifier shared by all ranks of one launch.
     * @param timeout      how long {@link #await()} waits.
     * @param pollInterval delay between checks.
     */
    public BrokerRendezvous(Path directory, String jobKey, Duration timeout, Duration pollInterval) {
        this.file = directory.resolve("broker-" + jobKey + ".url");
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    public Path file() {
        return file;
    }

    /**
     * @param brokerUrl URL other ranks should connect to.
     * @throws IOException if the file cannot be written.
     */
    public void publish(String brokerUrl) throws IOException {
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(temp, brokerUrl, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.info("Published broker URL {} to {}", brokerUrl, file);
    }

    /**
     * Waits for the coordinator's URL.
     *
     * @return the URL, or empty if none appeared within the timeout.
     * @throws InterruptedException if interrupted while waiting.
     */
    public Optional<String> await() throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        log.debug("Waiting up to {} for broker URL in {}", timeout, file);
        do {
            Optional<String> url = read();
            if (url.isPresent()) {
                return url;
            }
            Thread.sleep(Math.max(1, pollInterval.toMillis()));
        } while (System.nanoTime() < deadline);
        return read();
    }

    /**
     * Removes the published URL. Failures are logged, not thrown.
     */
    public void withdraw() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove rendezvous file {}: {}", file, e.getMessage());
        }
    }

    private Optional<String> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String url = Files.readString(file, StandardCharsets.UTF_8).trim();
            return url.isEmpty() ? Optional.empty() : Optional.of(url);
        } catch (IOException e) {
            log.debug("Rendezvous file not readable yet: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
