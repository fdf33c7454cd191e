package com.quantinfo.collector.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchedulerStatusResponse {

    private boolean running;
    private List<String> tasks;
}
