package com.example.apirecovery.recovery;

import com.example.apirecovery.model.HealthLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class HealthStatus {
    private HealthLevel status;
    private Map<String, Object> components;
    private List<String> recommendations;
}
