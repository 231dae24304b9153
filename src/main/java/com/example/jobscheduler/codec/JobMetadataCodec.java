package com.example.jobscheduler.codec;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.domain.model.RetryState;
import com.example.jobscheduler.exception.MetadataDeserializationException;
import org.springframework.stereotype.Component;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Compact binary codec for {@link JobMetadata} stored in the {@code extra} column.
 * <p>
 * Binary format (big endian, no version marker):
 * - job type code (1 byte)
 * - retry presence flag (1 byte, 0 or 1)
 * - retry attempts (4 bytes), only if present
 * - retry next-at epoch seconds (8 bytes), only if present
 * - retry next-at nano adjustment (4 bytes), only if present
 */
@Component
public class JobMetadataCodec {

    private static final int HEADER_SIZE = 2;
    private static final int RETRY_SIZE = 4 + 8 + 4;

    private static final byte RETRY_ABSENT = 0;
    private static final byte RETRY_PRESENT = 1;

    /**
     * Serialize metadata to bytes for storage.
     */
    public byte[] encode(JobMetadata metadata) {
        var retry = metadata.getRetry();
        var buffer = ByteBuffer.allocate(HEADER_SIZE + (retry != null ? RETRY_SIZE : 0));

        buffer.put(metadata.getJobType().getCode());
        if (retry == null) {
            buffer.put(RETRY_ABSENT);
        } else {
            buffer.put(RETRY_PRESENT);
            buffer.putInt(retry.getAttempts());
            buffer.putLong(retry.getNextAt().getEpochSecond());
            buffer.putInt(retry.getNextAt().getNano());
        }

        return buffer.array();
    }

    /**
     * Deserialize bytes produced by {@link #encode(JobMetadata)}.
     *
     * @throws MetadataDeserializationException if the bytes are not a valid encoding
     */
    public JobMetadata decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MetadataDeserializationException("empty input");
        }

        var buffer = ByteBuffer.wrap(bytes);
        try {
            SchedulerJobType jobType;
            try {
                jobType = SchedulerJobType.fromCode(buffer.get());
            } catch (IllegalArgumentException e) {
                throw new MetadataDeserializationException(e.getMessage(), e);
            }

            var flag = buffer.get();
            RetryState retry = null;
            if (flag == RETRY_PRESENT) {
                retry = readRetryState(buffer);
            } else if (flag != RETRY_ABSENT) {
                throw new MetadataDeserializationException("invalid retry flag " + flag);
            }

            if (buffer.hasRemaining()) {
                throw new MetadataDeserializationException(String.format("%d trailing bytes", buffer.remaining()));
            }

            return new JobMetadata(jobType, retry);
        } catch (BufferUnderflowException e) {
            throw new MetadataDeserializationException("unexpected end of input", e);
        }
    }

    private RetryState readRetryState(ByteBuffer buffer) {
        var attempts = buffer.getInt();
        if (attempts < 0) {
            throw new MetadataDeserializationException("negative retry attempts " + attempts);
        }

        var epochSecond = buffer.getLong();
        var nanos = buffer.getInt();
        if (nanos < 0 || nanos > 999_999_999) {
            throw new MetadataDeserializationException("invalid nano adjustment " + nanos);
        }

        try {
            return new RetryState(attempts, Instant.ofEpochSecond(epochSecond, nanos));
        } catch (DateTimeException e) {
            throw new MetadataDeserializationException("retry timestamp out of range", e);
        }
    }
}
