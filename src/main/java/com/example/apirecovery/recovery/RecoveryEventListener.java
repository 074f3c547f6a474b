package com.example.apirecovery.recovery;

import java.util.Map;

@FunctionalInterface
public interface RecoveryEventListener {

    void onEvent(RecoveryEvent event, Map<String, Object> data);
}
