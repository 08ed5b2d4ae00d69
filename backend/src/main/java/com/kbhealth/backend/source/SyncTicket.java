package com.kbhealth.backend.source;

import java.time.LocalDateTime;
import lombok.Value;

/**
 * Proof of ownership of a source's in-flight sync run, returned by
 * {@link SourceRegistry#beginSync(String)} and required to complete it.
 */
@Value
public class SyncTicket {
    String sourceId;
    String runId;
    LocalDateTime startedAt;
}
