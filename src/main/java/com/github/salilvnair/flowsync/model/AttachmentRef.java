package com.github.salilvnair.flowsync.model;

/**
 * Opaque reference to an attachment; the content itself is resolved by the host.
 */
public record AttachmentRef(
        String id,
        String name,
        String uri
) {}
