package com.phillippitts.engramdesk.service.sidecar.locator;

import com.phillippitts.engramdesk.exception.ExecutableNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the engram worker by trying a fixed list of candidates:
 * <ol>
 *   <li>bundled runtime ({@code engram-bundle.cjs} + {@code node-<arch>}) in the packaged resources</li>
 *   <li>the same bundle under {@code ./resources} relative to the working directory</li>
 *   <li>the packaged source tree {@code <resources>/engram}</li>
 *   <li>ancestors of the running executable's directory</li>
 *   <li>the configured override directory</li>
 *   <li>the working directory</li>
 * </ol>
 * Every bundle location is tried before any source tree.
 * Source-tree candidates are recognised by the marker file {@code bin/engram.js}.
 */
@Component
public class DefaultExecutableLocator implements ExecutableLocator {

    private static final Logger LOG = LogManager.getLogger(DefaultExecutableLocator.class);

    static final String BUNDLE_FILE = "engram-bundle.cjs";
    static final Path SCRIPT_MARKER = Path.of("bin", "engram.js");

    @Override
    public CommandSpec locate(LocatorEnvironment env) {
        List<Path> searched = new ArrayList<>();

        Optional<CommandSpec> bundled = findBundle(env, searched);
        if (bundled.isPresent()) {
            return bundled.get();
        }

        Optional<CommandSpec> script = findScriptRoot(env, searched);
        if (script.isPresent()) {
            return script.get();
        }

        throw new ExecutableNotFoundException(searched);
    }

    private Optional<CommandSpec> findBundle(LocatorEnvironment env, List<Path> searched) {
        if (env.resourceDir() != null) {
            // Packagers copy resources/** into <resources>/resources; some flatten it.
            Path nested = env.resourceDir().resolve("resources");
            if (hasBundle(nested, searched)) {
                return Optional.of(bundledCommand(nested, env, CommandSpec.Source.BUNDLED_RUNTIME));
            }
            if (hasBundle(env.resourceDir(), searched)) {
                return Optional.of(bundledCommand(env.resourceDir(), env, CommandSpec.Source.BUNDLED_RUNTIME));
            }
        }

        Path devResources = env.workingDir().resolve("resources");
        if (hasBundle(devResources, searched)) {
            return Optional.of(bundledCommand(devResources, env, CommandSpec.Source.DEVELOPMENT_BUNDLE));
        }
        return Optional.empty();
    }

    private Optional<CommandSpec> findScriptRoot(LocatorEnvironment env, List<Path> searched) {
        if (env.resourceDir() != null) {
            Path packaged = env.resourceDir().resolve("engram");
            if (hasMarker(packaged, searched)) {
                return Optional.of(scriptCommand(packaged, env, CommandSpec.Source.PACKAGED_SCRIPT));
            }
        }

        Path dir = env.executableDir();
        while (dir != null) {
            if (hasMarker(dir, searched)) {
                return Optional.of(scriptCommand(dir, env, CommandSpec.Source.EXECUTABLE_ANCESTOR));
            }
            dir = dir.getParent();
        }

        if (env.overrideDir() != null && hasMarker(env.overrideDir(), searched)) {
            return Optional.of(scriptCommand(env.overrideDir(), env, CommandSpec.Source.OVERRIDE_DIRECTORY));
        }

        if (hasMarker(env.workingDir(), searched)) {
            return Optional.of(scriptCommand(env.workingDir(), env, CommandSpec.Source.WORKING_DIRECTORY));
        }
        return Optional.empty();
    }

    private CommandSpec bundledCommand(Path resourcesDir, LocatorEnvironment env, CommandSpec.Source source) {
        Path nodeBinary = resourcesDir.resolve("node-" + archSuffix(env.osArch()));
        Path bundle = resourcesDir.resolve(BUNDLE_FILE);
        Path nodeModules = resourcesDir.resolve("node_modules");
        Path dylibDir = nodeModules.resolve("onnxruntime-node")
                .resolve("bin")
                .resolve("napi-v3")
                .resolve("darwin")
                .resolve(ortArch(env.osArch()));

        LOG.info("Using bundled sidecar from: {}", resourcesDir);
        LOG.info("  node binary: {}", nodeBinary);
        LOG.info("  bundle: {}", bundle);
        LOG.info("  NODE_PATH: {}", nodeModules);

        return new CommandSpec(
                nodeBinary.toString(),
                List.of(bundle.toString(), "start", "--port", String.valueOf(env.port())),
                Map.of("NODE_PATH", nodeModules.toString(),
                        "DYLD_LIBRARY_PATH", dylibDir.toString()),
                resourcesDir,
                source);
    }

    private CommandSpec scriptCommand(Path root, LocatorEnvironment env, CommandSpec.Source source) {
        Path script = root.resolve(SCRIPT_MARKER);
        LOG.info("Using {} to run: {} ({})", env.nodeCommand(), script, source);
        return new CommandSpec(
                env.nodeCommand(),
                List.of(script.toString(), "start", "--port", String.valueOf(env.port())),
                Map.of(),
                root,
                source);
    }

    private static boolean hasBundle(Path dir, List<Path> searched) {
        Path candidate = dir.resolve(BUNDLE_FILE);
        searched.add(candidate);
        return Files.exists(candidate);
    }

    private static boolean hasMarker(Path dir, List<Path> searched) {
        Path candidate = dir.resolve(SCRIPT_MARKER);
        searched.add(candidate);
        return Files.exists(candidate);
    }

    /**
     * Target-triple suffix of the bundled node binary for the given {@code os.arch}.
     */
    static String archSuffix(String osArch) {
        return switch (osArch) {
            case "aarch64", "arm64" -> "aarch64-apple-darwin";
            case "x86_64", "amd64" -> "x86_64-apple-darwin";
            default -> osArch;
        };
    }

    /**
     * onnxruntime native library directory name for the given {@code os.arch}.
     */
    static String ortArch(String osArch) {
        return switch (osArch) {
            case "x86_64", "amd64" -> "x64";
            default -> "arm64";
        };
    }
}
