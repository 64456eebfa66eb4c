package com.questrail.bridge.transport.process;

import com.questrail.bridge.api.BridgeStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeServiceLocator
 * -----------------------------------------------------------------------------
 * Finds the bridge service script on disk.
 *
 * <p>Strategy, in order:</p>
 * <ol>
 *   <li>The packaged location: {@code resourceDirectory/relativePath}, when a
 *       resource directory is configured. This is what installed builds use.</li>
 *   <li>An upward search from {@code searchStart}: the start directory and its
 *       ancestors, at most {@code maxDepth} directories in total, checking
 *       {@code dir/relativePath} in each. This is what development builds
 *       use.</li>
 * </ol>
 *
 * <p>If neither yields an existing file a {@link BridgeStartupException} is
 * thrown naming the relative path and the starting directory.</p>
 */
public final class BridgeServiceLocator
{
    private static final Logger log = LoggerFactory.getLogger(BridgeServiceLocator.class);

    private final Optional<Path> resourceDirectory;
    private final Path relativePath;
    private final Path searchStart;
    private final int maxDepth;

    public BridgeServiceLocator(Optional<Path> resourceDirectory, Path relativePath, Path searchStart, int maxDepth)
    {
        this.resourceDirectory = Objects.requireNonNull(resourceDirectory, "resourceDirectory");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
        this.searchStart = Objects.requireNonNull(searchStart, "searchStart");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @return absolute path of the service script
     * @throws BridgeStartupException if no candidate exists
     */
    public Path locate()
    {
        if (resourceDirectory.isPresent()) {
            Path packaged = resourceDirectory.get().resolve(relativePath);
            log.debug("Checking packaged bridge service at {}", packaged);
            if (Files.isRegularFile(packaged)) {
                log.info("Found bridge service via resources at {}", packaged);
                return packaged.toAbsolutePath();
            }
        }

        Path current = searchStart.toAbsolutePath().normalize();
        for (int level = 0; level < maxDepth && current != null; level++) {
            Path candidate = current.resolve(relativePath);
            log.debug("Level {}: checking bridge service at {}", level, candidate);
            if (Files.isRegularFile(candidate)) {
                log.info("Found bridge service at {}", candidate);
                return candidate;
            }
            current = current.getParent();
        }

        throw new BridgeStartupException("Could not find bridge service (" + relativePath + "). "
                + "Current directory: " + searchStart.toAbsolutePath().normalize() + ". "
                + "Please ensure the bridge service is built before starting the application.");
    }
}
