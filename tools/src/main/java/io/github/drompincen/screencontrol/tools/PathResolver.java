package io.github.drompincen.screencontrol.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Turns client-supplied paths into absolute local paths: expands {@code ~}, resolves
 * relative paths against a base directory and translates between Windows drive paths
 * and WSL mounts when running on one side of that boundary.
 */
public class PathResolver {

    private static final boolean IS_WSL = detectWsl();

    private final Path baseDirectory;

    public PathResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    private static boolean detectWsl() {
        Path version = Path.of("/proc/version");
        if (!Files.isReadable(version)) {
            return false;
        }
        try {
            String text = Files.readString(version).toLowerCase(Locale.ROOT);
            return text.contains("microsoft") || text.contains("wsl");
        } catch (IOException e) {
            return false;
        }
    }

    public static boolean isWsl() { return IS_WSL; }

    public Path resolve(String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        String path = inputPath.trim();
        if (path.equals("~") || path.startsWith("~/")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        Path translated = translate(path);
        return translated.isAbsolute()
                ? translated.normalize()
                : baseDirectory.resolve(translated).normalize();
    }

    private static Path translate(String path) {
        if (IS_WSL) {
            // C:\dir or C:/dir -> /mnt/c/dir
            if (path.length() >= 3 && path.charAt(1) == ':' && (path.charAt(2) == '\\' || path.charAt(2) == '/')) {
                char drive = Character.toLowerCase(path.charAt(0));
                return Path.of("/mnt/" + drive + path.substring(2).replace('\\', '/'));
            }
        } else if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win")) {
            // /mnt/c/dir -> C:\dir
            if (path.startsWith("/mnt/") && path.length() > 6 && path.charAt(6) == '/') {
                char drive = Character.toUpperCase(path.charAt(5));
                return Path.of(drive + ":" + path.substring(6).replace('/', '\\'));
            }
        }
        return Path.of(path);
    }
}
