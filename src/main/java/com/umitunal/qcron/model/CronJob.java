package com.umitunal.qcron.model;

import com.umitunal.qcron.serialization.PayloadCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Persisted record of one recurring job.
 *
 * The schedule, target function and arguments are fixed when the job is registered. Only the
 * two task pointers change afterwards: {@code pendingTickTaskId} is the outstanding tick that
 * will fire next, {@code lastDispatchTaskId} is the task that ran the target function most
 * recently and is used to detect overlapping runs.
 */
public class CronJob {
    public static final String KEY_PREFIX = "job:";
    public static final String NAME_INDEX_PREFIX = "name:";

    private final String id;
    private final String name;
    private final String functionName;
    private final Map<String, Object> args;
    private final Schedule schedule;

    private String pendingTickTaskId;
    private String lastDispatchTaskId;
    private long createdAt;
    private long lastModified;
    private long version;

    public CronJob(String id, String name, String functionName, Map<String, Object> args, Schedule schedule) {
        this.id = id;
        this.name = name;
        this.functionName = functionName;
        this.args = args == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.schedule = schedule;
        this.createdAt = System.currentTimeMillis();
        this.lastModified = this.createdAt;
        this.version = 0;
    }

    public String getId() {
        return id;
    }

    /**
     * Unique name, or null for anonymous jobs.
     */
    public String getName() {
        return name;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public String getPendingTickTaskId() {
        return pendingTickTaskId;
    }

    public String getLastDispatchTaskId() {
        return lastDispatchTaskId;
    }

    public boolean isScheduled() {
        return pendingTickTaskId != null;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastModified() {
        return lastModified;
    }

    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setPendingTickTaskId(String pendingTickTaskId) {
        this.pendingTickTaskId = pendingTickTaskId;
    }

    void setLastDispatchTaskId(String lastDispatchTaskId) {
        this.lastDispatchTaskId = lastDispatchTaskId;
    }

    void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * Point the job at a newly armed tick.
     */
    public void armTick(String taskId) {
        this.pendingTickTaskId = taskId;
        touch();
    }

    /**
     * Remember the task that just dispatched the target function.
     */
    public void recordDispatch(String taskId) {
        this.lastDispatchTaskId = taskId;
        touch();
    }

    private void touch() {
        this.lastModified = System.currentTimeMillis();
        this.version++;
    }

    @Override
    public String toString() {
        return String.format("CronJob{id='%s', name='%s', function='%s', schedule=%s, tick='%s', dispatch='%s', version=%d}",
                id, name, functionName, schedule, pendingTickTaskId, lastDispatchTaskId, version);
    }

    public byte[] serialize(PayloadCodec<Map<String, Object>> argsCodec) {
        return new CronJobSerializer(argsCodec).serialize(this);
    }

    public static CronJob deserialize(byte[] bytes, PayloadCodec<Map<String, Object>> argsCodec) {
        return new CronJobSerializer(argsCodec).deserialize(bytes);
    }

    /**
     * Storage key for a job row. Format: "job:" + id
     */
    public static byte[] createStorageKey(String jobId) {
        return (KEY_PREFIX + jobId).getBytes(UTF_8);
    }

    /**
     * Storage key for the name index entry. Format: "name:" + name
     */
    public static byte[] createNameIndexKey(String name) {
        return (NAME_INDEX_PREFIX + name).getBytes(UTF_8);
    }
}
