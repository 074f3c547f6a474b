package com.example.apirecovery.queue;

import com.example.apirecovery.model.HealthLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class QueueHealth {
    private HealthLevel status;
    private List<String> issues;
    private List<String> recommendations;
}
