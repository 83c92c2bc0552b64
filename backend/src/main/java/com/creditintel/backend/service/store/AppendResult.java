package com.creditintel.backend.service.store;

public enum AppendResult {
    /** First observation with this identity. */
    APPENDED,
    /** Same identity, different content; stored as a newer revision. */
    REVISED,
    /** Identical to the latest stored revision; nothing written. */
    DUPLICATE
}
