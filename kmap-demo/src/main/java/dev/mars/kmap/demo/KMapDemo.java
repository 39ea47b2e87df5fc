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
package dev.mars.kmap.demo;

import dev.mars.kmap.KMapConfig;
import dev.mars.kmap.codec.Codecs;
import dev.mars.kmap.map.OrderedMap;
import dev.mars.kmap.persist.PersistenceTask;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Demo entry point for the ordered map.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Restoring a map from its last snapshot</li>
 *   <li>Insertion-ordered updates (existing keys keep their position)</li>
 *   <li>Saving a compressed snapshot in the background</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link KMapConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dkmap.dataDir=/path -Dkmap.compress=true ...}</li>
 *   <li>Environment variables: {@code KMAP_DATA_DIR, KMAP_COMPRESS, ...}</li>
 *   <li>Properties file: {@code kmap.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * mvn -q install -DskipTests
 * mvn -q dependency:build-classpath -pl kmap-demo -Dmdep.outputFile=cp.txt
 *
 * # Run with default configuration
 * java -cp "kmap-demo/target/classes:$(cat kmap-demo/cp.txt)" dev.mars.kmap.demo.KMapDemo
 *
 * # Compressed snapshots in a custom directory
 * java -Dkmap.compress=true -cp ... dev.mars.kmap.demo.KMapDemo /tmp/kmap-demo
 * </pre>
 *
 * @see KMapConfig
 */
public class KMapDemo {

    private static final String SNAPSHOT_FILE = "demo.kmap";

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|           KMap Demo                   |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        KMapConfig config = args.length > 0 && !args[0].isBlank()
                ? KMapConfig.builder().dataDir(args[0]).build()
                : KMapConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        Path snapshot = config.dataDir().resolve(SNAPSHOT_FILE);
        OrderedMap<String, String> map = new OrderedMap<>(Codecs.STRING, Codecs.STRING, config);

        // Restore the previous run, if any
        if (Files.exists(snapshot)) {
            map.load(snapshot);
            System.out.println("[OK] Restored " + map.size() + " entries from " + snapshot.toAbsolutePath());
            List<String> keys = map.keys();
            int start = Math.max(0, keys.size() - 3);
            if (!keys.isEmpty()) {
                System.out.println("\n  Last entries in map:");
                for (String key : keys.subList(start, keys.size())) {
                    System.out.printf("    %s = %s%n", key, map.getOrDefault(key, ""));
                }
                System.out.println();
            }
        } else {
            System.out.println("[OK] No snapshot at " + snapshot.toAbsolutePath() + ", starting empty");
        }

        // Update the run counter in place and append a new entry
        long runs = Long.parseLong(map.getOrDefault("runs", "0")) + 1;
        map.set("runs", Long.toString(runs));
        map.set("run-" + runs, Instant.now().toString());
        System.out.println("[OK] Recorded run " + runs + " (" + map.size() + " entries, " +
                map.totalSize() + " bytes)");

        // Save in the background
        PersistenceTask task = map.saveAsync(snapshot, config.saveOptions());
        task.await();
        if (task.error().isPresent()) {
            System.out.println("[FAIL] Snapshot failed: " + task.error().get().getMessage());
            System.exit(1);
        }
        System.out.println("[OK] Snapshot written to " + snapshot.toAbsolutePath() +
                " (" + Files.size(snapshot) + " bytes, progress " + task.progress() + "%)");

        System.out.println("\n  Keys in order:");
        map.range((key, value) -> {
            System.out.printf("    %s = %s%n", key, value);
            return true;
        });

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Demo complete!                       |");
        System.out.println("|  Run again to see entries restored.   |");
        System.out.println("+---------------------------------------+");
    }
}
