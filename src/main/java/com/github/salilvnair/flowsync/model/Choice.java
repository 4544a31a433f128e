package com.github.salilvnair.flowsync.model;

public record Choice(
        String label,
        String value
) {}
