package com.github.salilvnair.flowsync.api.dto;

import lombok.Data;

@Data
public class PlanReviewRequest {

    private String plan;
    private String title;
}
