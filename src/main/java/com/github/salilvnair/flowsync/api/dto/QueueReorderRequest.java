package com.github.salilvnair.flowsync.api.dto;

import lombok.Data;

@Data
public class QueueReorderRequest {

    private int fromIndex;
    private int toIndex;
}
