package com.umitunal.qcron.config;

/**
 * Configuration for the RocksDB job store.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final ArgsFormat argsFormat;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.argsFormat = builder.argsFormat;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public ArgsFormat getArgsFormat() { return argsFormat; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    /**
     * Encoding used for the argument map of each job.
     */
    public enum ArgsFormat {
        JSON,
        KRYO
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 2;
        private int backgroundThreads = 2;
        private ArgsFormat argsFormat = ArgsFormat.JSON;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Enable durable writes (WAL + fsync on every commit).
         * Job records are small and rarely written, so this is on by default.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memory buffers.
         * Default: 2
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Set the argument encoding. Changing it for an existing data directory makes
         * stored records unreadable.
         * Default: JSON
         */
        public Builder withArgsFormat(ArgsFormat format) {
            this.argsFormat = format;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
