package com.deskmate;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "Deskmate";

    private final Path dataPath;
    private final Path modelPath;
    private final String backendClass;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataPath, Path modelPath, String backendClass, Path logPath, int port, boolean devMode) {
        this.dataPath = dataPath;
        this.modelPath = modelPath;
        this.backendClass = backendClass;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataPath() {
        return dataPath;
    }

    /**
     * Model manifest (*.model3.json) to load at startup; null when none was given.
     */
    public Path getModelPath() {
        return modelPath;
    }

    /**
     * Fully qualified class name of the animation backend binding; null selects the headless model.
     */
    public String getBackendClass() {
        return backendClass;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the default data path based on the operating system.
     * Windows: %USERPROFILE%\Documents\Deskmate\data
     * macOS: ~/Documents/Deskmate/data
     * Linux: ~/Deskmate/data
     */
    public static Path getDefaultDataPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "data");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "data");
        } else {
            return Paths.get(userHome, APP_NAME, "data");
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Deskmate\logs
     * macOS: ~/Library/Logs/Deskmate
     * Linux: ~/.local/share/Deskmate/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("deskmate.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Let the server fail later with a clear bind error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataPath = null;
        private Path modelPath = null;
        private String backendClass = null;
        private int preferredPort = 8765;
        private boolean devMode = false;

        public Builder dataPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder modelPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.modelPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder backendClass(String className) {
            if (className != null && !className.isBlank()) {
                this.backendClass = className.trim();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data=")) {
                    dataPath(arg.substring("--data=".length()));
                } else if ("--data".equals(arg) && i + 1 < args.length) {
                    dataPath(args[++i]);
                }

                else if (arg.startsWith("--model=")) {
                    modelPath(arg.substring("--model=".length()));
                } else if ("--model".equals(arg) && i + 1 < args.length) {
                    modelPath(args[++i]);
                }

                else if (arg.startsWith("--backend=")) {
                    backendClass(arg.substring("--backend=".length()));
                } else if ("--backend".equals(arg) && i + 1 < args.length) {
                    backendClass(args[++i]);
                }

                else if (arg.startsWith("--port=")) {
                    try {
                        this.preferredPort = Integer.parseInt(arg.substring("--port=".length()));
                    } catch (NumberFormatException ignored) {}
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    try {
                        this.preferredPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException ignored) {}
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        public AppConfig build() throws IOException {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            Files.createDirectories(data);
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(data, modelPath, backendClass, logPath, port, devMode);
        }

        /**
         * Builds without touching the network or the log directory.
         */
        AppConfig buildUnresolved() {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            return new AppConfig(data, modelPath, backendClass, getLogFilePath(), preferredPort, devMode);
        }
    }
}
