package com.phillippitts.engramdesk.service.sidecar.locator;

import com.phillippitts.engramdesk.EngramDeskApplication;
import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URISyntaxException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;

/**
 * Snapshot of the runtime facts the {@link ExecutableLocator} resolves against.
 *
 * @param resourceDir packaged resources directory, or {@code null} when not packaged
 * @param workingDir current working directory
 * @param executableDir directory of the running application, or {@code null} if unknown
 * @param overrideDir explicitly configured worker root, or {@code null}
 * @param osArch value of {@code os.arch}
 * @param nodeCommand interpreter for the script form
 * @param port worker HTTP port passed as {@code --port}
 */
public record LocatorEnvironment(
        Path resourceDir,
        Path workingDir,
        Path executableDir,
        Path overrideDir,
        String osArch,
        String nodeCommand,
        int port
) {

    private static final Logger LOG = LogManager.getLogger(LocatorEnvironment.class);

    /**
     * Captures the environment of the running JVM.
     *
     * @param locator locator configuration
     * @param port worker port
     * @return environment snapshot
     */
    public static LocatorEnvironment detect(SidecarProperties.Locator locator, int port) {
        return new LocatorEnvironment(
                toPath(locator.getResourceDir()),
                Path.of("").toAbsolutePath(),
                detectExecutableDir(),
                toPath(locator.getOverrideDir()),
                System.getProperty("os.arch", ""),
                locator.getNodeCommand(),
                port);
    }

    private static Path toPath(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Path.of(value).toAbsolutePath().normalize();
    }

    /**
     * Directory holding the application jar (or classes directory), falling back to the
     * directory of the JVM launcher binary.
     */
    private static Path detectExecutableDir() {
        try {
            CodeSource source = EngramDeskApplication.class.getProtectionDomain().getCodeSource();
            if (source != null && source.getLocation() != null) {
                Path location = Path.of(source.getLocation().toURI()).toAbsolutePath();
                return Files.isDirectory(location) ? location : location.getParent();
            }
        } catch (URISyntaxException | SecurityException | IllegalArgumentException
                 | FileSystemNotFoundException e) {
            LOG.debug("Code source location unusable ({}); using JVM launcher directory", e.toString());
        }
        return ProcessHandle.current().info().command()
                .map(cmd -> Path.of(cmd).toAbsolutePath().getParent())
                .orElse(null);
    }
}
