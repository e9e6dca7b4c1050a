/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.collectionloader;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.Level;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable configuration of a {@link CollectionLoader}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "fetch_threads": 0,                          // 0 = unbounded pool
 *   "fetch_thread_prefix": "collection-loader-fetch",
 *   "coordinator_thread_name": "collection-loader-coordinator",
 *   "initial_page_behavior": "CANCEL_ALL_OTHER",
 *   "next_page_behavior": "SKIP_SAME_REASON",
 *   "previous_page_behavior": "SKIP_SAME_REASON",
 *   "lifecycle_log_level": "DEBUG"
 * }
 * }</pre>
 *
 * <p>Every key is optional; a missing key takes the default shown above.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * CollectionLoaderConfig config = CollectionLoaderConfig.loadFromFile(Path.of("loader.json"));
 * CollectionLoader<...> loader = CollectionLoaders.forHelper(helper).withConfig(config).build();
 * }</pre>
 *
 * @see CollectionLoaders
 * @since 4.0.0
 */
public class CollectionLoaderConfig {

    public static final String DEFAULT_FETCH_THREAD_PREFIX = "collection-loader-fetch";
    public static final String DEFAULT_COORDINATOR_THREAD_NAME = "collection-loader-coordinator";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("fetch_threads")
    private Integer fetchThreads;

    @SerializedName("fetch_thread_prefix")
    private String fetchThreadPrefix;

    @SerializedName("coordinator_thread_name")
    private String coordinatorThreadName;

    @SerializedName("initial_page_behavior")
    private ConcurrentLoadBehavior initialPageBehavior;

    @SerializedName("next_page_behavior")
    private ConcurrentLoadBehavior nextPageBehavior;

    @SerializedName("previous_page_behavior")
    private ConcurrentLoadBehavior previousPageBehavior;

    /** Log4j level name for admission, skip, cancellation and completion messages */
    @SerializedName("lifecycle_log_level")
    private String lifecycleLogLevel;

    public CollectionLoaderConfig() {
    }

    /**
     * @return a configuration with every value at its default
     */
    public static CollectionLoaderConfig defaults() {
        return new CollectionLoaderConfig();
    }

    public static CollectionLoaderConfig load(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        CollectionLoaderConfig config;
        try {
            config = GSON.fromJson(reader, CollectionLoaderConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid collection loader configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        config.validate();
        return config;
    }

    public static CollectionLoaderConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * Loads a configuration from the classpath.
     *
     * @param resourceName resource path, as for {@link ClassLoader#getResourceAsStream}
     * @return the configuration
     * @throws IOException if the resource cannot be read
     * @throws IllegalArgumentException if the resource does not exist or is not valid
     */
    public static CollectionLoaderConfig loadFromResource(String resourceName) throws IOException {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = CollectionLoaderConfig.class.getClassLoader();
        }
        try (InputStream stream = classLoader.getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new IllegalArgumentException("No such configuration resource: " + resourceName);
            }
            return load(new InputStreamReader(stream, StandardCharsets.UTF_8));
        }
    }

    public void save(Writer writer) {
        GSON.toJson(this, writer);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private void validate() {
        if (fetchThreads != null && fetchThreads < 0) {
            throw new IllegalArgumentException("fetch_threads must be 0 (unbounded) or positive, got " + fetchThreads);
        }
        if (lifecycleLogLevel != null && Level.getLevel(lifecycleLogLevel.toUpperCase()) == null) {
            throw new IllegalArgumentException("Unknown lifecycle_log_level: " + lifecycleLogLevel);
        }
    }

    /**
     * @return the fetch pool size; 0 means an unbounded pool
     */
    public int getFetchThreads() {
        return fetchThreads != null ? fetchThreads : 0;
    }

    public CollectionLoaderConfig setFetchThreads(int fetchThreads) {
        if (fetchThreads < 0) {
            throw new IllegalArgumentException("fetchThreads must be 0 (unbounded) or positive");
        }
        this.fetchThreads = fetchThreads;
        return this;
    }

    public String getFetchThreadPrefix() {
        return fetchThreadPrefix != null ? fetchThreadPrefix : DEFAULT_FETCH_THREAD_PREFIX;
    }

    public CollectionLoaderConfig setFetchThreadPrefix(String fetchThreadPrefix) {
        this.fetchThreadPrefix = Objects.requireNonNull(fetchThreadPrefix, "fetchThreadPrefix");
        return this;
    }

    public String getCoordinatorThreadName() {
        return coordinatorThreadName != null ? coordinatorThreadName : DEFAULT_COORDINATOR_THREAD_NAME;
    }

    public CollectionLoaderConfig setCoordinatorThreadName(String coordinatorThreadName) {
        this.coordinatorThreadName = Objects.requireNonNull(coordinatorThreadName, "coordinatorThreadName");
        return this;
    }

    public ConcurrentLoadBehavior getInitialPageBehavior() {
        return initialPageBehavior != null ? initialPageBehavior : ConcurrentLoadBehavior.CANCEL_ALL_OTHER;
    }

    public CollectionLoaderConfig setInitialPageBehavior(ConcurrentLoadBehavior behavior) {
        this.initialPageBehavior = Objects.requireNonNull(behavior, "behavior");
        return this;
    }

    public ConcurrentLoadBehavior getNextPageBehavior() {
        return nextPageBehavior != null ? nextPageBehavior : ConcurrentLoadBehavior.SKIP_SAME_REASON;
    }

    public CollectionLoaderConfig setNextPageBehavior(ConcurrentLoadBehavior behavior) {
        this.nextPageBehavior = Objects.requireNonNull(behavior, "behavior");
        return this;
    }

    public ConcurrentLoadBehavior getPreviousPageBehavior() {
        return previousPageBehavior != null ? previousPageBehavior : ConcurrentLoadBehavior.SKIP_SAME_REASON;
    }

    public CollectionLoaderConfig setPreviousPageBehavior(ConcurrentLoadBehavior behavior) {
        this.previousPageBehavior = Objects.requireNonNull(behavior, "behavior");
        return this;
    }

    public Level getLifecycleLogLevel() {
        return lifecycleLogLevel != null ? Level.getLevel(lifecycleLogLevel.toUpperCase()) : Level.DEBUG;
    }

    public CollectionLoaderConfig setLifecycleLogLevel(Level level) {
        this.lifecycleLogLevel = Objects.requireNonNull(level, "level").name();
        return this;
    }

    @Override
    public String toString() {
        return "CollectionLoaderConfig" + toJson();
    }
}
