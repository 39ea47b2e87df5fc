/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.kmap;

import dev.mars.kmap.map.SizeAccountant;
import dev.mars.kmap.persist.SaveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for a map and its snapshots.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dkmap.limitMb=64})</li>
 *   <li>Environment variables (e.g., {@code KMAP_LIMIT_MB})</li>
 *   <li>Properties file ({@code kmap.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>limitMb</td><td>kmap.limitMb</td><td>KMAP_LIMIT_MB</td><td>0 (unbounded)</td></tr>
 *   <tr><td>compress</td><td>kmap.compress</td><td>KMAP_COMPRESS</td><td>false</td></tr>
 *   <tr><td>compressLevel</td><td>kmap.compressLevel</td><td>KMAP_COMPRESS_LEVEL</td><td>0 (default level)</td></tr>
 *   <tr><td>syncEnabled</td><td>kmap.syncEnabled</td><td>KMAP_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>dataDir</td><td>kmap.dataDir</td><td>KMAP_DATA_DIR</td><td>~/.kmap/data</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # kmap.properties
 * kmap.limitMb=256
 * kmap.compress=true
 * kmap.compressLevel=6
 * kmap.syncEnabled=true
 * kmap.dataDir=/var/lib/kmap
 * </pre>
 */
public final class KMapConfig {

    private static final Logger LOG = LoggerFactory.getLogger(KMapConfig.class);

    private static final String PROPERTIES_FILE = "kmap.properties";

    // Property keys
    private static final String PROP_LIMIT_MB = "kmap.limitMb";
    private static final String PROP_COMPRESS = "kmap.compress";
    private static final String PROP_COMPRESS_LEVEL = "kmap.compressLevel";
    private static final String PROP_SYNC_ENABLED = "kmap.syncEnabled";
    private static final String PROP_DATA_DIR = "kmap.dataDir";

    // Environment variable keys
    private static final String ENV_LIMIT_MB = "KMAP_LIMIT_MB";
    private static final String ENV_COMPRESS = "KMAP_COMPRESS";
    private static final String ENV_COMPRESS_LEVEL = "KMAP_COMPRESS_LEVEL";
    private static final String ENV_SYNC_ENABLED = "KMAP_SYNC_ENABLED";
    private static final String ENV_DATA_DIR = "KMAP_DATA_DIR";

    // Defaults
    private static final int DEFAULT_LIMIT_MB = 0;
    private static final boolean DEFAULT_COMPRESS = false;
    private static final int DEFAULT_COMPRESS_LEVEL = 0;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".kmap", "data");

    private final int limitMb;
    private final boolean compress;
    private final int compressLevel;
    private final boolean syncEnabled;
    private final Path dataDir;

    private KMapConfig(Builder builder) {
        this.limitMb = builder.limitMb;
        this.compress = builder.compress;
        this.compressLevel = builder.compressLevel;
        this.syncEnabled = builder.syncEnabled;
        this.dataDir = builder.dataDir;
    }

    /** Size ceiling in mebibytes; zero or negative means unbounded. */
    public int limitMb() {
        return limitMb;
    }

    /** Size ceiling in bytes, or {@code -1} when unbounded. */
    public long limitBytes() {
        return SizeAccountant.limitFromMb(limitMb);
    }

    /** Whether snapshots are gzip-compressed. */
    public boolean compress() {
        return compress;
    }

    /** Gzip level for compressed snapshots, {@code 0} selects the default level. */
    public int compressLevel() {
        return compressLevel;
    }

    /** Whether snapshot files and their directory are fsynced after writing. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Directory the demo keeps its snapshots in. */
    public Path dataDir() {
        return dataDir;
    }

    /** Save options derived from {@link #compress()} and {@link #compressLevel()}. */
    public SaveOptions saveOptions() {
        return new SaveOptions(compress, compressLevel);
    }

    @Override
    public String toString() {
        return "KMapConfig{" +
                "limitMb=" + limitMb +
                ", compress=" + compress +
                ", compressLevel=" + compressLevel +
                ", syncEnabled=" + syncEnabled +
                ", dataDir=" + dataDir +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code KMapConfig.builder().build()}.
     */
    public static KMapConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link KMapConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Integer limitMb;
        private Boolean compress;
        private Integer compressLevel;
        private Boolean syncEnabled;
        private Path dataDir;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the size ceiling in mebibytes (default: 0, unbounded). */
        public Builder limitMb(int limitMb) {
            this.limitMb = limitMb;
            return this;
        }

        /** Enables or disables snapshot compression (default: false). */
        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        /** Sets the gzip level (default: 0, the library default). */
        public Builder compressLevel(int compressLevel) {
            this.compressLevel = compressLevel;
            return this;
        }

        /** Enables or disables fsync of snapshot files (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public KMapConfig build() {
            if (limitMb == null) {
                limitMb = resolve(PROP_LIMIT_MB, ENV_LIMIT_MB, Integer::parseInt, DEFAULT_LIMIT_MB);
            }
            if (compress == null) {
                compress = resolve(PROP_COMPRESS, ENV_COMPRESS, Boolean::parseBoolean, DEFAULT_COMPRESS);
            }
            if (compressLevel == null) {
                compressLevel = resolve(PROP_COMPRESS_LEVEL, ENV_COMPRESS_LEVEL, Integer::parseInt, DEFAULT_COMPRESS_LEVEL);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (dataDir == null) {
                dataDir = resolve(PROP_DATA_DIR, ENV_DATA_DIR, Path::of, DEFAULT_DATA_DIR);
            }
            return new KMapConfig(this);
        }

        /**
         * Walks system property, environment variable and properties file in order.
         * A blank or unparseable value at one level falls through to the next.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[] candidates = {
                    System.getProperty(sysProp),
                    System.getenv(envVar),
                    fileProperties.getProperty(sysProp)
            };
            for (String candidate : candidates) {
                if (candidate == null || candidate.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(candidate.trim());
                } catch (RuntimeException e) {
                    LOG.warn("Ignoring invalid value '{}' for {}: {}", candidate, sysProp, e.toString());
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = KMapConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
