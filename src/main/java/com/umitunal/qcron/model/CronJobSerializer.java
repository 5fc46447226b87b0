package com.umitunal.qcron.model;

import com.umitunal.qcron.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for CronJob records.
 *
 * Binary format:
 * - id length (4 bytes) + id bytes (UTF-8)
 * - name length (4 bytes, -1 for null) + name bytes (UTF-8)
 * - functionName length (4 bytes) + functionName bytes (UTF-8)
 * - args length (4 bytes) + args bytes (codec)
 * - schedule kind ordinal (4 bytes)
 * - intervalMs (8 bytes)
 * - cronspec length (4 bytes, -1 for null) + cronspec bytes (UTF-8)
 * - pendingTickTaskId length (4 bytes, -1 for null) + bytes (UTF-8)
 * - lastDispatchTaskId length (4 bytes, -1 for null) + bytes (UTF-8)
 * - createdAt (8 bytes)
 * - lastModified (8 bytes)
 * - version (8 bytes)
 */
public class CronJobSerializer {

    private final PayloadCodec<Map<String, Object>> argsCodec;

    public CronJobSerializer(PayloadCodec<Map<String, Object>> argsCodec) {
        this.argsCodec = argsCodec;
    }

    public byte[] serialize(CronJob job) {
        byte[] idBytes = job.getId().getBytes(UTF_8);
        byte[] nameBytes = bytesOrNull(job.getName());
        byte[] functionBytes = job.getFunctionName().getBytes(UTF_8);
        byte[] argsBytes = argsCodec.encode(job.getArgs());
        byte[] cronspecBytes = bytesOrNull(job.getSchedule().getCronspec());
        byte[] tickBytes = bytesOrNull(job.getPendingTickTaskId());
        byte[] dispatchBytes = bytesOrNull(job.getLastDispatchTaskId());

        int totalSize = 4 + idBytes.length +
                        4 + length(nameBytes) +
                        4 + functionBytes.length +
                        4 + argsBytes.length +
                        4 +                              // schedule kind
                        8 +                              // intervalMs
                        4 + length(cronspecBytes) +
                        4 + length(tickBytes) +
                        4 + length(dispatchBytes) +
                        8 +                              // createdAt
                        8 +                              // lastModified
                        8;                               // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);

        putBytes(buffer, idBytes);
        putBytes(buffer, nameBytes);
        putBytes(buffer, functionBytes);
        putBytes(buffer, argsBytes);

        buffer.putInt(job.getSchedule().getKind().ordinal());
        buffer.putLong(job.getSchedule().getIntervalMs());
        putBytes(buffer, cronspecBytes);

        putBytes(buffer, tickBytes);
        putBytes(buffer, dispatchBytes);

        buffer.putLong(job.getCreatedAt());
        buffer.putLong(job.getLastModified());
        buffer.putLong(job.getVersion());

        return buffer.array();
    }

    public CronJob deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        String id = readString(buffer);
        String name = readString(buffer);
        String functionName = readString(buffer);
        Map<String, Object> args = argsCodec.decode(readBytes(buffer));

        Schedule.Kind kind = Schedule.Kind.values()[buffer.getInt()];
        long intervalMs = buffer.getLong();
        String cronspec = readString(buffer);
        // Stored schedules were validated on registration
        Schedule schedule = kind == Schedule.Kind.INTERVAL
                ? Schedule.interval(intervalMs)
                : Schedule.cron(cronspec);

        CronJob job = new CronJob(id, name, functionName, args, schedule);
        job.setPendingTickTaskId(readString(buffer));
        job.setLastDispatchTaskId(readString(buffer));
        job.setCreatedAt(buffer.getLong());
        job.setLastModified(buffer.getLong());
        job.setVersion(buffer.getLong());
        return job;
    }

    private static byte[] bytesOrNull(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    private static int length(byte[] bytes) {
        return bytes != null ? bytes.length : 0;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] readBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static String readString(ByteBuffer buffer) {
        byte[] bytes = readBytes(buffer);
        return bytes != null ? new String(bytes, UTF_8) : null;
    }
}
