package org.prisma.datapipeline.utils;

import java.util.BitSet;

import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameFailure;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameResult;
import org.prisma.datapipeline.api.results.FrameTask;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import jakarta.jms.BytesMessage;
import jakarta.jms.JMSException;

/**
 * Wire format of frame tasks and outcomes exchanged with worker ranks.
 * <p>
 * Tasks travel as JSON text. Outcomes travel as bytes messages: metadata in properties, and
 * for a success the value block followed by the per-cell fit bitmap.
 */
public final class FrameMessageCodec {

    public static final String AVOID_WORKER = "avoidWorker";
    public static final String CONTROL_TYPE = "type";
    public static final String SHUTDOWN = "shutdown";
    public static final String WORKER_EXIT = "workerExit";
    public static final String WORKER = "worker";

    static final String POSITION = "position";
    static final String GLOBAL_INDEX = "globalIndex";
    static final String ATTEMPT = "attempt";
    static final String SUCCESS = "success";
    static final String FAILURE_KIND = "failureKind";
    static final String FAILURE_MESSAGE = "failureMessage";
    static final String AZIMUTHS = "azimuths";
    static final String PEAKS = "peaks";
    static final String MEASUREMENTS = "measurements";

    private static final Gson GSON = new Gson();

    private FrameMessageCodec() {
    }

    public static String encodeTask(FrameTask task) {
        return GSON.toJson(task);
    }

    /**
     * @param json task JSON.
     * @return the task.
     * @throws IllegalArgumentException if the JSON is not a task.
     */
    public static FrameTask decodeTask(String json) {
        try {
            FrameTask task = GSON.fromJson(json, FrameTask.class);
            if (task == null || task.frame() == null || task.frame().source() == null) {
                throw new IllegalArgumentException("Incomplete task: " + json);
            }
            return task;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed task: " + e.getMessage(), e);
        }
    }

    /**
     * Writes an outcome into an empty bytes message.
     */
    public static void writeOutcome(BytesMessage message, FrameOutcome outcome) throws JMSException {
        message.setIntProperty(POSITION, outcome.position());
        message.setIntProperty(GLOBAL_INDEX, outcome.globalIndex());
        message.setIntProperty(ATTEMPT, outcome.attempt());
        message.setStringProperty(WORKER, outcome.workerId());
        message.setBooleanProperty(SUCCESS, outcome.isSuccess());
        if (!outcome.isSuccess()) {
            message.setStringProperty(FAILURE_KIND, outcome.failure().kind().name());
            message.setStringProperty(FAILURE_MESSAGE, outcome.failure().message());
            return;
        }
        FrameResult result = outcome.result();
        message.setIntProperty(AZIMUTHS, result.azimuths());
        message.setIntProperty(PEAKS, result.peaks());
        message.setIntProperty(MEASUREMENTS, result.measurements());
        float[] values = result.values();
        message.writeInt(values.length);
        for (float value : values) {
            message.writeFloat(value);
        }
        byte[] bitmap = result.fitted().toByteArray();
        message.writeInt(bitmap.length);
        message.writeBytes(bitmap);
    }

    /**
     * Reads an outcome written by {@link #writeOutcome(BytesMessage, FrameOutcome)}.
     */
    public static FrameOutcome readOutcome(BytesMessage message) throws JMSException {
        int position = message.getIntProperty(POSITION);
        int globalIndex = message.getIntProperty(GLOBAL_INDEX);
        int attempt = message.getIntProperty(ATTEMPT);
        String worker = message.getStringProperty(WORKER);
        if (!message.getBooleanProperty(SUCCESS)) {
            FrameFailure failure = new FrameFailure(FailureKind.valueOf(message.getStringProperty(FAILURE_KIND)),
                message.getStringProperty(FAILURE_MESSAGE));
            return FrameOutcome.of(position, globalIndex, attempt, worker, null, failure);
        }
        float[] values = new float[message.readInt()];
        for (int i = 0; i < values.length; i++) {
            values[i] = message.readFloat();
        }
        byte[] bitmap = new byte[message.readInt()];
        if (bitmap.length > 0 && message.readBytes(bitmap) != bitmap.length) {
            throw new JMSException("Truncated fit bitmap for frame " + globalIndex);
        }
        FrameResult result = new FrameResult(message.getIntProperty(AZIMUTHS), message.getIntProperty(PEAKS),
            message.getIntProperty(MEASUREMENTS), values, BitSet.valueOf(bitmap));
        return FrameOutcome.of(position, globalIndex, attempt, worker, result, null);
    }
}
