package com.questrail.bridge.transport.process;

import com.questrail.bridge.api.BridgeStartupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BridgeServiceLocatorTest
 * -----------------------------------------------------------------------------
 * Resolution order: packaged resource directory, then the start directory and
 * its ancestors up to the depth limit.
 */
final class BridgeServiceLocatorTest
{
    private static final Path SERVICE = Path.of("dist", "bridge", "provider-bridge.js");

    @TempDir
    Path root;

    @Test
    void packagedResourceWins() throws IOException
    {
        Path resources = Files.createDirectories(root.resolve("resources"));
        Path packaged = touch(resources.resolve(SERVICE));
        Path project = Files.createDirectories(root.resolve("project"));
        touch(project.resolve(SERVICE));

        BridgeServiceLocator locator = new BridgeServiceLocator(Optional.of(resources), SERVICE, project, 5);

        assertEquals(packaged.toAbsolutePath(), locator.locate());
    }

    @Test
    void missingPackagedResourceFallsBackToSearch() throws IOException
    {
        Path resources = Files.createDirectories(root.resolve("resources"));
        Path project = Files.createDirectories(root.resolve("project"));
        Path script = touch(project.resolve(SERVICE));

        BridgeServiceLocator locator = new BridgeServiceLocator(Optional.of(resources), SERVICE, project, 5);

        assertEquals(script.toAbsolutePath().normalize(), locator.locate());
    }

    @Test
    void findsServiceInStartDirectory() throws IOException
    {
        Path script = touch(root.resolve(SERVICE));

        BridgeServiceLocator locator = new BridgeServiceLocator(Optional.empty(), SERVICE, root, 5);

        assertEquals(script.toAbsolutePath().normalize(), locator.locate());
    }

    @Test
    void findsServiceInFourthAncestor() throws IOException
    {
        Path script = touch(root.resolve(SERVICE));
        Path start = Files.createDirectories(root.resolve("a/b/c/d"));

        BridgeServiceLocator locator = new BridgeServiceLocator(Optional.empty(), SERVICE, start, 5);

        assertEquals(script.toAbsolutePath().normalize(), locator.locate());
    }

    @Test
    void doesNotSearchBeyondMaxDepth() throws IOException
    {
        touch(root.resolve(SERVICE));
        Path start = Files.createDirectories(root.resolve("a/b/c/d/e"));

        BridgeServiceLocator locator = new BridgeServiceLocator(Optional.empty(), SERVICE, start, 5);

        BridgeStartupException e = assertThrows(BridgeStartupException.class, locator::locate);
        assertTrue(e.getMessage().contains(SERVICE.toString()));
        assertTrue(e.getMessage().contains(start.toAbsolutePath().normalize().toString()));
        assertTrue(e.getMessage().contains("Please ensure the bridge service is built"));
    }

    @Test
    void directoryWithServiceNameIsNotAMatch() throws IOException
    {
        Files.createDirectories(root.resolve(SERVICE));

        BridgeServiceLocator locator = new BridgeServiceLocator(Optional.empty(), SERVICE, root, 1);

        assertThrows(BridgeStartupException.class, locator::locate);
    }

    @Test
    void rejectsNonPositiveDepth()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new BridgeServiceLocator(Optional.empty(), SERVICE, root, 0));
    }

    private static Path touch(Path file) throws IOException
    {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "// bridge");
    }
}
