package org.muma.tiny.redis.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis.properties) > 默认值
 */
@Getter
@Setter
public class TinyRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(TinyRedisConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "redis.properties";

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Persistence (AOF) ---
    private boolean appendOnly = true;
    private AppendFsync appendFsync = AppendFsync.EVERYSEC;
    private long appendFsyncIntervalMillis = 1000;
    private String appendDir = ".";
    private String appendFilename = "database.aof";

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Enums ---
    public enum AppendFsync {
        ALWAYS, EVERYSEC, NO
    }

    /**
     * 按优先级加载完整配置：先配置文件，再环境变量，最后命令行参数
     */
    public static TinyRedisConfig load(String[] args, Map<String, String> env) {
        TinyRedisConfig config = new TinyRedisConfig();
        // --config 需要最先确定
        config.configFilePath = findConfigPath(args);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("TinyRedisConfig initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--port" -> this.port = parseInt("--port", args[++i]);
                case "--appendonly" -> this.appendOnly = parseYesNo(args[++i]);
                case "--dir" -> this.appendDir = args[++i];
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
        log.info("Config loaded from args: port={}, appendonly={}", port, appendOnly);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Persistence
        loadPersistenceConfig(props);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("REDIS_PORT");
        if (envPort != null) {
            this.port = parseInt("REDIS_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envAof = env.get("REDIS_APPENDONLY");
        if (envAof != null) {
            this.appendOnly = parseYesNo(envAof);
            log.info("AppendOnly overridden by ENV: {}", this.appendOnly);
        }

        String envDir = env.get("REDIS_APPEND_DIR");
        if (envDir != null) {
            this.appendDir = envDir;
            log.info("AppendDir overridden by ENV: {}", this.appendDir);
        }
    }

    private void loadPersistenceConfig(Properties props) {
        String aof = getString(props, "appendonly", appendOnly ? "yes" : "no");
        this.appendOnly = parseYesNo(aof);

        String fsync = getString(props, "appendfsync", appendFsync.name());
        try {
            this.appendFsync = AppendFsync.valueOf(fsync.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid appendfsync value '{}', using default EVERYSEC.", fsync);
            this.appendFsync = AppendFsync.EVERYSEC;
        }

        String interval = getString(props, "appendfsync-interval-ms", String.valueOf(appendFsyncIntervalMillis));
        try {
            long millis = Long.parseLong(interval.trim());
            if (millis <= 0) {
                throw new NumberFormatException("must be positive");
            }
            this.appendFsyncIntervalMillis = millis;
        } catch (NumberFormatException e) {
            log.warn("Invalid appendfsync-interval-ms '{}', using default {}.", interval, appendFsyncIntervalMillis);
        }

        this.appendDir = getString(props, "appenddirname", appendDir);
        this.appendFilename = getString(props, "appendfilename", appendFilename);
    }

    private static boolean parseYesNo(String value) {
        return "yes".equalsIgnoreCase(value.trim()) || "true".equalsIgnoreCase(value.trim());
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", aof=" + appendOnly + ", fsync=" + appendFsync
                + ", aofFile=" + appendDir + "/" + appendFilename + "}";
    }
}
